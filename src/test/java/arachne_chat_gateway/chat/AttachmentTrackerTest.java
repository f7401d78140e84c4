package arachne_chat_gateway.chat;

import arachne_chat_gateway.exceptions.AttachmentException;
import arachne_chat_gateway.model.Attachment;
import arachne_chat_gateway.model.AttachmentStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AttachmentTrackerTest {

    private static final long MB = 1024L * 1024;

    private AttachmentTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new AttachmentTracker(Set.of("image/png", "image/jpeg", "image/webp", "image/heic", "image/heif"), 20 * MB);
    }

    @ParameterizedTest
    @ValueSource(strings = {"image/png", "IMAGE/JPEG", "image/heic"})
    void shouldAcceptAllowedImageTypes(String mimeType) {
        assertDoesNotThrow(() -> tracker.validate(mimeType, MB));
    }

    @ParameterizedTest
    @ValueSource(strings = {"application/pdf", "image/gif", "text/plain"})
    void shouldRejectOtherTypes(String mimeType) {
        AttachmentException exception = assertThrows(AttachmentException.class, () -> tracker.validate(mimeType, MB));

        assertTrue(exception.getMessage().startsWith("Tipo de arquivo não permitido"));
    }

    @Test
    void shouldEnforceAggregateSizeCap() {
        tracker.register("a.png", "image/png", 12 * MB, "a.png");
        tracker.register("b.png", "image/png", 8 * MB, "b.png");

        AttachmentException exception = assertThrows(AttachmentException.class,
                () -> tracker.register("c.png", "image/png", 1, "c.png"));

        assertEquals("Tamanho total dos anexos excede o limite de 20 MB", exception.getMessage());
        assertEquals(20 * MB, tracker.totalBytes());
        assertEquals(2, tracker.list().size());
    }

    @Test
    void shouldReleaseQuotaOfErroredAttachments() {
        tracker.register("a.png", "image/png", 15 * MB, "a.png");
        tracker.markError("a.png", null);

        assertEquals(0, tracker.totalBytes());
        assertDoesNotThrow(() -> tracker.register("b.png", "image/png", 10 * MB, "b.png"));
        assertEquals("Falha no upload", tracker.list().get(0).getErrorMessage());
    }

    @Test
    void shouldRevalidateOnRestart() {
        tracker.register("a.png", "image/png", 15 * MB, "a.png");
        tracker.markError("a.png", "timeout");
        tracker.register("b.png", "image/png", 10 * MB, "b.png");

        assertThrows(AttachmentException.class, () -> tracker.restart("a.png"));

        tracker.remove("b.png");
        Attachment restarted = tracker.restart("a.png");
        assertEquals(AttachmentStatus.PENDING, restarted.getStatus());
        assertNull(restarted.getErrorMessage());
    }

    @Test
    void shouldRejectDuplicateOrBlankKeys() {
        tracker.register("a.png", "image/png", MB, "a.png");

        assertThrows(AttachmentException.class, () -> tracker.register("a.png", "image/png", MB, "a.png"));
        assertThrows(AttachmentException.class, () -> tracker.register(" ", "image/png", MB, "x.png"));
        assertThrows(AttachmentException.class, () -> tracker.validate("image/png", 0));
    }

    @Test
    void shouldMoveForwardThroughUploadLifecycle() {
        tracker.register("a.png", "image/png", MB, "a.png");

        assertEquals(AttachmentStatus.UPLOADING, tracker.beginUpload("a.png").getStatus());
        assertEquals(AttachmentStatus.UPLOADED, tracker.markUploaded("a.png").getStatus());

        AttachmentException exception = assertThrows(AttachmentException.class, () -> tracker.beginUpload("a.png"));
        assertEquals("Transição inválida do anexo de uploaded para uploading", exception.getMessage());
        assertThrows(AttachmentException.class, () -> tracker.restart("a.png"));
        assertThrows(AttachmentException.class, () -> tracker.markUploaded("desconhecido.png"));
    }

    @Test
    void shouldBlockSendingUntilEveryUploadFinished() {
        tracker.register("a.png", "image/png", MB, "a.png");
        tracker.register("b.png", "image/png", MB, "b.png");
        tracker.beginUpload("a.png");
        tracker.markUploaded("a.png");

        assertFalse(tracker.isReadyToSend());
        assertThrows(AttachmentException.class, () -> tracker.drainForSend());
        assertEquals(2, tracker.list().size());

        tracker.beginUpload("b.png");
        tracker.markUploaded("b.png");
        List<Attachment> sent = tracker.drainForSend();

        assertEquals(2, sent.size());
        assertEquals("a.png", sent.get(0).getObjectKey());
        assertTrue(tracker.list().isEmpty());
        assertTrue(tracker.isReadyToSend());
    }

    @Test
    void shouldReturnCopiesFromList() {
        tracker.register("a.png", "image/png", MB, "a.png");
        Attachment listed = tracker.list().get(0);

        tracker.beginUpload("a.png");

        assertEquals(AttachmentStatus.PENDING, listed.getStatus());
    }
}
