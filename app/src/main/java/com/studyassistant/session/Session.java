package com.studyassistant.session;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * The authenticated user of the running application.
 *
 * Created by {@link NavigationController#login} and discarded by
 * {@link NavigationController#logout}. Services take it as their first
 * argument and scope every query to {@link #getUserId()}.
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class Session {

    private final Long userId;
    private final String username;
    private final LocalDateTime startedAt;
}
