package com.studyassistant.service;

import com.studyassistant.entity.AIContent;
import com.studyassistant.entity.AIContent.ContentKind;
import com.studyassistant.entity.ChatMessage;
import com.studyassistant.entity.ChatMessage.Role;
import com.studyassistant.exception.NetworkException;
import com.studyassistant.exception.ValidationException;
import com.studyassistant.repository.ChatMessageRepository;
import com.studyassistant.service.ai.AIGateway;
import com.studyassistant.session.Session;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

import java.net.SocketTimeoutException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChatService Unit Tests")
class ChatServiceTest {

    @Mock
    private ChatMessageRepository chatMessageRepository;

    @Mock
    private AIGateway aiGateway;

    @Mock
    private AIContentService aiContentService;

    private ChatService chatService;
    private Session session;

    @BeforeEach
    void setUp() {
        chatService = new ChatService(chatMessageRepository, aiGateway, aiContentService);
        ReflectionTestUtils.setField(chatService, "historyLimit", 50);
        session = new Session(1L, "alice", LocalDateTime.of(2026, 3, 10, 9, 0));
    }

    @Test
    @DisplayName("history should return the newest messages oldest first")
    void testHistory() {
        ChatMessage older = new ChatMessage(1L, Role.USER, "What is osmosis?");
        ChatMessage newer = new ChatMessage(1L, Role.MODEL, "Osmosis is ...");
        when(chatMessageRepository.findByOwnerIdOrderByIdDesc(eq(1L), any(Pageable.class)))
                .thenReturn(List.of(newer, older));

        List<ChatMessage> history = chatService.history(session);

        assertEquals(List.of(older, newer), history);
    }

    @Test
    @DisplayName("send should store both sides of the turn after the reply arrives")
    @SuppressWarnings("unchecked")
    void testSend() {
        // Arrange
        when(chatMessageRepository.findByOwnerIdOrderByIdDesc(eq(1L), any(Pageable.class)))
                .thenReturn(new ArrayList<>());
        when(aiGateway.converse(eq(session), anyList(), eq("Explain mitosis"))).thenReturn("Mitosis is ...");

        // Act
        String reply = chatService.send(session, "  Explain mitosis ");

        // Assert
        assertEquals("Mitosis is ...", reply);
        ArgumentCaptor<List<ChatMessage>> saved = ArgumentCaptor.forClass(List.class);
        verify(chatMessageRepository).saveAll(saved.capture());
        assertEquals(2, saved.getValue().size());
        assertEquals(Role.USER, saved.getValue().get(0).getRole());
        assertEquals("Explain mitosis", saved.getValue().get(0).getContent());
        assertEquals(Role.MODEL, saved.getValue().get(1).getRole());
    }

    @Test
    @DisplayName("A failed request leaves the history unchanged")
    void testSend_Failure() {
        when(chatMessageRepository.findByOwnerIdOrderByIdDesc(eq(1L), any(Pageable.class)))
                .thenReturn(new ArrayList<>());
        when(aiGateway.converse(eq(session), anyList(), eq("Hello")))
                .thenThrow(NetworkException.unreachable("Gemini", new SocketTimeoutException("timed out")));

        assertThrows(NetworkException.class, () -> chatService.send(session, "Hello"));
        verify(chatMessageRepository, never()).saveAll(anyList());
    }

    @Test
    @DisplayName("send should reject an empty message without calling the AI")
    void testSend_Blank() {
        assertThrows(ValidationException.class, () -> chatService.send(session, "   "));
        verifyNoInteractions(aiGateway);
    }

    @Test
    @DisplayName("snapshot should archive the transcript as chat snapshot")
    void testSnapshot() {
        when(chatMessageRepository.findByOwnerIdOrderByIdDesc(eq(1L), any(Pageable.class)))
                .thenReturn(List.of(
                        new ChatMessage(1L, Role.MODEL, "It is the loss of water."),
                        new ChatMessage(1L, Role.USER, "What is transpiration?")));
        AIContent archived = new AIContent(1L, ContentKind.CHAT_SNAPSHOT, "What is transpiration?", "", "");
        when(aiContentService.save(eq(session), eq(ContentKind.CHAT_SNAPSHOT), isNull(),
                eq("What is transpiration?"), any())).thenReturn(archived);

        AIContent result = chatService.snapshot(session);

        assertSame(archived, result);
        ArgumentCaptor<String> transcript = ArgumentCaptor.forClass(String.class);
        verify(aiContentService).save(eq(session), eq(ContentKind.CHAT_SNAPSHOT), isNull(),
                eq("What is transpiration?"), transcript.capture());
        assertTrue(transcript.getValue().startsWith("You: What is transpiration?"));
        assertTrue(transcript.getValue().contains("AI: It is the loss of water."));
    }

    @Test
    @DisplayName("snapshot of an empty conversation is rejected")
    void testSnapshot_Empty() {
        when(chatMessageRepository.findByOwnerIdOrderByIdDesc(eq(1L), any(Pageable.class)))
                .thenReturn(List.of());

        assertThrows(ValidationException.class, () -> chatService.snapshot(session));
        verifyNoInteractions(aiContentService);
    }
}
