package arachne_chat_gateway.service;

import arachne_chat_gateway.chat.AttachmentTracker;
import arachne_chat_gateway.chat.ClientContext;
import arachne_chat_gateway.dto.request.AttachmentRequest;
import arachne_chat_gateway.dto.request.AttachmentStatusRequest;
import arachne_chat_gateway.exceptions.AttachmentException;
import arachne_chat_gateway.model.Attachment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AttachmentService {

    private final GatewayMetricsService gatewayMetricsService;

    public Attachment register(ClientContext context, AttachmentRequest request) {
        try {
            return context.getAttachments().register(
                    request.getObjectKey(), request.getMimeType(), request.getSizeBytes(), request.getFilename());
        } catch (AttachmentException e) {
            gatewayMetricsService.recordAttachmentRejected("validation");
            throw e;
        }
    }

    public Attachment updateStatus(ClientContext context, AttachmentStatusRequest request) {
        AttachmentTracker tracker = context.getAttachments();
        return switch (request.getStatus()) {
            case UPLOADING -> tracker.beginUpload(request.getObjectKey());
            case UPLOADED -> tracker.markUploaded(request.getObjectKey());
            case ERROR -> {
                gatewayMetricsService.recordAttachmentRejected("upload_failed");
                yield tracker.markError(request.getObjectKey(), request.getErrorMessage());
            }
            case PENDING -> throw new AttachmentException("Use a rota de reenvio para voltar um anexo a pendente");
        };
    }

    public Attachment retry(ClientContext context, String objectKey) {
        return context.getAttachments().restart(objectKey);
    }

    public void remove(ClientContext context, String objectKey) {
        if (!context.getAttachments().remove(objectKey)) {
            throw new AttachmentException("Anexo não encontrado: " + objectKey);
        }
    }

    public List<Attachment> list(ClientContext context) {
        return context.getAttachments().list();
    }
}
