package com.umitunal.sendlater.api;

import com.umitunal.sendlater.core.JobStoreException;
import com.umitunal.sendlater.credential.CredentialStore;
import com.umitunal.sendlater.credential.CredentialUnavailableException;
import com.umitunal.sendlater.delivery.Conversation;
import com.umitunal.sendlater.delivery.ConversationPage;
import com.umitunal.sendlater.delivery.VkApiClient;
import com.umitunal.sendlater.delivery.VkApiException;
import com.umitunal.sendlater.scheduler.DeliveryScheduler;
import com.umitunal.sendlater.scheduler.JobAccessDeniedException;
import com.umitunal.sendlater.scheduler.ScheduleValidationException;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static com.umitunal.sendlater.api.ApiException.Status;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SendLaterServiceTest {

    private static final String SECRET = "Zm9vYmFyYmF6cXV4cXV1eA";
    private static final String AUTH = "Secret " + SECRET;

    @Mock
    private CredentialStore credentials;

    @Mock
    private VkApiClient vk;

    @Mock
    private DeliveryScheduler scheduler;

    private SendLaterService service;

    @BeforeEach
    void setUp() {
        service = new SendLaterService(credentials, vk, scheduler);
    }

    @Test
    @DisplayName("Should link a valid token under its VK user id")
    void testLinkAccount() throws Exception {
        // Given
        when(vk.validateToken("vk1.a.valid-token")).thenReturn(Optional.of(777L));
        when(credentials.link("777", "vk1.a.valid-token")).thenReturn("new-secret");

        // When
        LinkAccountResponse response = service.linkAccount(new LinkAccountRequest("vk1.a.valid-token"));

        // Then
        assertThat(response.getClientSecret()).isEqualTo("new-secret");
    }

    @Test
    @DisplayName("Should reject short or invalid tokens")
    void testLinkRejected() throws Exception {
        // Given
        when(vk.validateToken("vk1.a.expired-token")).thenReturn(Optional.empty());

        // Then
        assertStatus(() -> service.linkAccount(new LinkAccountRequest("short")), Status.BAD_REQUEST);
        assertStatus(() -> service.linkAccount(new LinkAccountRequest("vk1.a.expired-token")), Status.BAD_REQUEST);
        verify(vk, never()).validateToken("short");
        verify(credentials, never()).link(any(), any());
    }

    @Test
    @DisplayName("Should authenticate only well-formed Secret headers")
    void testAuthenticate() throws Exception {
        // Given
        when(credentials.findOwnerBySecret(SECRET)).thenReturn(Optional.of("777"));
        when(credentials.findOwnerBySecret("unknown")).thenReturn(Optional.empty());

        // Then
        assertThat(service.authenticate(AUTH)).isEqualTo("777");
        assertThat(service.authenticate("secret " + SECRET)).isEqualTo("777");
        assertStatus(() -> service.authenticate(null), Status.UNAUTHORIZED);
        assertStatus(() -> service.authenticate("Bearer " + SECRET), Status.UNAUTHORIZED);
        assertStatus(() -> service.authenticate("Secret"), Status.UNAUTHORIZED);
        assertStatus(() -> service.authenticate("Secret unknown"), Status.UNAUTHORIZED);
    }

    @Test
    @DisplayName("Should schedule for the authenticated account")
    void testSchedule() throws Exception {
        // Given
        when(credentials.findOwnerBySecret(SECRET)).thenReturn(Optional.of("777"));
        when(scheduler.isRunning()).thenReturn(true);
        when(scheduler.submit("777", "2030-01-01T10:00:00Z", "100", "hi")).thenReturn("job-1");

        // When
        ScheduleResponse response = service.schedule(AUTH, new ScheduleRequest("100", "hi", "2030-01-01T10:00:00Z"));

        // Then
        assertThat(response.getJobId()).isEqualTo("job-1");
        assertThat(response.getMessage()).isEqualTo("Task scheduled successfully");
    }

    @Test
    @DisplayName("Should map scheduling failures to statuses")
    void testScheduleFailures() throws Exception {
        // Given
        when(credentials.findOwnerBySecret(SECRET)).thenReturn(Optional.of("777"));
        when(scheduler.isRunning()).thenReturn(true, true, false);
        when(scheduler.submit(eq("777"), eq("yesterday"), anyString(), anyString()))
                .thenThrow(new ScheduleValidationException(ScheduleValidationException.Reason.MALFORMED_TIME, "bad time"));
        when(scheduler.submit(eq("777"), eq("2030-01-01T10:00:00Z"), anyString(), anyString()))
                .thenThrow(new JobStoreException("disk full"));

        // Then
        assertStatus(() -> service.schedule(AUTH, new ScheduleRequest("1", "hi", "yesterday")), Status.BAD_REQUEST);
        assertStatus(() -> service.schedule(AUTH, new ScheduleRequest("1", "hi", "2030-01-01T10:00:00Z")),
                Status.INTERNAL_ERROR);
        assertStatus(() -> service.schedule(AUTH, new ScheduleRequest("1", "hi", "2030-01-01T10:00:00Z")),
                Status.SERVICE_UNAVAILABLE);
    }

    @Test
    @DisplayName("Should treat deletes of unknown jobs as success and foreign jobs as forbidden")
    void testDeleteSchedule() throws Exception {
        // Given
        when(credentials.findOwnerBySecret(SECRET)).thenReturn(Optional.of("777"));
        when(scheduler.cancel("777", "gone")).thenReturn(false);
        when(scheduler.cancel("777", "foreign")).thenThrow(new JobAccessDeniedException("foreign"));

        // When
        service.deleteSchedule(AUTH, "gone");

        // Then
        assertStatus(() -> service.deleteSchedule(AUTH, "foreign"), Status.FORBIDDEN);
        verify(scheduler).cancel("777", "gone");
    }

    @Test
    @DisplayName("Should list only after authentication")
    void testListSchedules() throws Exception {
        // Given
        when(credentials.findOwnerBySecret(SECRET)).thenReturn(Optional.of("777"));
        when(scheduler.list("777")).thenReturn(List.of());

        // Then
        assertThat(service.listSchedules(AUTH)).isEmpty();
        assertStatus(() -> service.listSchedules(null), Status.UNAUTHORIZED);
        verify(scheduler, times(1)).list(any());
    }

    @Test
    @DisplayName("Should page conversations with the stored token")
    void testConversations() throws Exception {
        // Given
        ConversationPage page = new ConversationPage(List.of(new Conversation(55L, "Dialog ID 55")), 1);
        when(credentials.findOwnerBySecret(SECRET)).thenReturn(Optional.of("777"));
        when(credentials.resolve("777")).thenReturn("vk-token");
        when(vk.fetchConversations("vk-token", 0, 10)).thenReturn(page);
        when(vk.fetchConversations("vk-token", 10, 10)).thenThrow(new VkApiException(15, "VK Error 15: Access denied"));

        // Then
        assertThat(service.conversations(AUTH, 0, 10)).isSameAs(page);
        assertStatus(() -> service.conversations(AUTH, 10, 10), Status.BAD_REQUEST);
        assertStatus(() -> service.conversations(AUTH, -1, 10), Status.BAD_REQUEST);
        assertStatus(() -> service.conversations(AUTH, 0, 51), Status.BAD_REQUEST);
    }

    @Test
    @DisplayName("Should fail when the stored credential cannot be used")
    void testConversationsCredentialUnavailable() throws Exception {
        // Given
        when(credentials.findOwnerBySecret(SECRET)).thenReturn(Optional.of("777"));
        when(credentials.resolve("777")).thenThrow(new CredentialUnavailableException(
                CredentialUnavailableException.Reason.DECRYPTION_FAILED, "bad key"));

        // Then
        assertStatus(() -> service.conversations(AUTH, 0, 10), Status.INTERNAL_ERROR);
        verifyNoInteractions(vk);
    }

    private static void assertStatus(ThrowingCallable call, Status status) {
        assertThatThrownBy(call)
                .isInstanceOfSatisfying(ApiException.class, e -> assertThat(e.getStatus()).isEqualTo(status));
    }
}
