package arachne_chat_gateway.service;

import arachne_chat_gateway.chat.AttachmentTracker;
import arachne_chat_gateway.chat.ClientContext;
import arachne_chat_gateway.dto.request.AttachmentRequest;
import arachne_chat_gateway.dto.request.AttachmentStatusRequest;
import arachne_chat_gateway.exceptions.AttachmentException;
import arachne_chat_gateway.model.Attachment;
import arachne_chat_gateway.model.AttachmentStatus;
import arachne_chat_gateway.session.SessionRefresher;
import arachne_chat_gateway.session.SessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AttachmentServiceTest {

    @Mock
    private GatewayMetricsService gatewayMetricsService;

    @InjectMocks
    private AttachmentService attachmentService;

    private ClientContext context;

    @BeforeEach
    void setUp() {
        context = new ClientContext("user-1", new SessionStore(), mock(SessionRefresher.class),
                new AttachmentTracker(Set.of("image/png"), 10L * 1024 * 1024));
    }

    @Test
    void shouldRegisterAndAdvanceAttachment() {
        attachmentService.register(context, new AttachmentRequest("a.png", "image/png", 1024, "a.png"));

        Attachment uploading = attachmentService.updateStatus(context,
                new AttachmentStatusRequest("a.png", AttachmentStatus.UPLOADING, null));
        Attachment uploaded = attachmentService.updateStatus(context,
                new AttachmentStatusRequest("a.png", AttachmentStatus.UPLOADED, null));

        assertEquals(AttachmentStatus.UPLOADING, uploading.getStatus());
        assertEquals(AttachmentStatus.UPLOADED, uploaded.getStatus());
        verifyNoInteractions(gatewayMetricsService);
    }

    @Test
    void shouldCountRejectedRegistration() {
        assertThrows(AttachmentException.class, () -> attachmentService.register(context,
                new AttachmentRequest("a.pdf", "application/pdf", 1024, "a.pdf")));

        verify(gatewayMetricsService).recordAttachmentRejected("validation");
    }

    @Test
    void shouldRecordUploadFailureAndAllowRetry() {
        attachmentService.register(context, new AttachmentRequest("a.png", "image/png", 1024, "a.png"));

        Attachment failed = attachmentService.updateStatus(context,
                new AttachmentStatusRequest("a.png", AttachmentStatus.ERROR, "S3 indisponível"));
        Attachment retried = attachmentService.retry(context, "a.png");

        assertEquals("S3 indisponível", failed.getErrorMessage());
        assertEquals(AttachmentStatus.PENDING, retried.getStatus());
        verify(gatewayMetricsService).recordAttachmentRejected("upload_failed");
    }

    @Test
    void shouldRefusePendingAsTargetStatus() {
        attachmentService.register(context, new AttachmentRequest("a.png", "image/png", 1024, "a.png"));

        assertThrows(AttachmentException.class, () -> attachmentService.updateStatus(context,
                new AttachmentStatusRequest("a.png", AttachmentStatus.PENDING, null)));
    }

    @Test
    void shouldFailToRemoveUnknownAttachment() {
        assertThrows(AttachmentException.class, () -> attachmentService.remove(context, "nada.png"));
        assertTrue(attachmentService.list(context).isEmpty());
    }
}
