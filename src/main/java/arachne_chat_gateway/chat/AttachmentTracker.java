package arachne_chat_gateway.chat;

import arachne_chat_gateway.exceptions.AttachmentException;
import arachne_chat_gateway.model.Attachment;
import arachne_chat_gateway.model.AttachmentStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Upload lifecycle of the attachments of the message being composed.
 *
 * <p>The sum of sizes of every attachment that is not errored never exceeds {@code maxTotalBytes}.
 */
@Slf4j
public class AttachmentTracker {

    private final Set<String> allowedMimeTypes;
    private final long maxTotalBytes;
    private final Map<String, Attachment> attachments = new LinkedHashMap<>();

    public AttachmentTracker(Set<String> allowedMimeTypes, long maxTotalBytes) {
        this.allowedMimeTypes = allowedMimeTypes.stream()
                .map(type -> type.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.maxTotalBytes = maxTotalBytes;
    }

    /**
     * Checks a candidate file against the allowed types and the remaining aggregate budget.
     *
     * @throws AttachmentException when the file would be rejected
     */
    public synchronized void validate(String mimeType, long sizeBytes) {
        if (mimeType == null || !allowedMimeTypes.contains(mimeType.toLowerCase(Locale.ROOT))) {
            throw new AttachmentException("Tipo de arquivo não permitido: " + mimeType);
        }
        if (sizeBytes <= 0) {
            throw new AttachmentException("Tamanho do arquivo inválido");
        }
        long total = totalBytes() + sizeBytes;
        if (total > maxTotalBytes) {
            throw new AttachmentException(String.format(
                "Tamanho total dos anexos excede o limite de %d MB", maxTotalBytes / (1024 * 1024)));
        }
    }

    public synchronized Attachment register(String objectKey, String mimeType, long sizeBytes, String filename) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new AttachmentException("Chave do objeto é obrigatória");
        }
        if (attachments.containsKey(objectKey)) {
            throw new AttachmentException("Anexo já registrado: " + objectKey);
        }
        validate(mimeType, sizeBytes);
        Attachment attachment = new Attachment(objectKey, mimeType, sizeBytes, filename);
        attachments.put(objectKey, attachment);
        log.debug("Attachment {} registered ({} bytes)", objectKey, sizeBytes);
        return attachment.copy();
    }

    public synchronized Attachment beginUpload(String objectKey) {
        return transition(objectKey, AttachmentStatus.UPLOADING, null);
    }

    public synchronized Attachment markUploaded(String objectKey) {
        return transition(objectKey, AttachmentStatus.UPLOADED, null);
    }

    public synchronized Attachment markError(String objectKey, String errorMessage) {
        String message = errorMessage == null || errorMessage.isBlank() ? "Falha no upload" : errorMessage;
        return transition(objectKey, AttachmentStatus.ERROR, message);
    }

    /**
     * Re-validates an errored attachment and puts it back to pending for another attempt.
     */
    public synchronized Attachment restart(String objectKey) {
        Attachment attachment = require(objectKey);
        if (attachment.getStatus() != AttachmentStatus.ERROR) {
            throw new AttachmentException("Somente anexos com erro podem ser reenviados");
        }
        validate(attachment.getMimeType(), attachment.getSizeBytes());
        attachment.restart();
        return attachment.copy();
    }

    public synchronized boolean remove(String objectKey) {
        return attachments.remove(objectKey) != null;
    }

    public synchronized List<Attachment> list() {
        return attachments.values().stream().map(Attachment::copy).collect(Collectors.toList());
    }

    /** True when every attachment finished uploading; an empty draft is ready. */
    public synchronized boolean isReadyToSend() {
        return attachments.values().stream().allMatch(a -> a.getStatus() == AttachmentStatus.UPLOADED);
    }

    /**
     * Hands the uploaded attachments over to the message being sent and empties the draft.
     *
     * @throws AttachmentException when an attachment is still pending, uploading or errored
     */
    public synchronized List<Attachment> drainForSend() {
        if (!isReadyToSend()) {
            throw new AttachmentException("Aguarde o envio de todos os anexos antes de enviar a mensagem");
        }
        List<Attachment> drained = new ArrayList<>(list());
        attachments.clear();
        return drained;
    }

    /**
     * Puts attachments handed over by {@link #drainForSend()} back into the draft, ahead of any registered
     * since. Keys already present are left as they are.
     */
    public synchronized void restore(List<Attachment> drained) {
        Map<String, Attachment> merged = new LinkedHashMap<>();
        drained.forEach(a -> merged.put(a.getObjectKey(), a.copy()));
        attachments.forEach(merged::put);
        attachments.clear();
        attachments.putAll(merged);
        log.debug("{} attachment(s) restored to the draft", drained.size());
    }

    public synchronized long totalBytes() {
        return attachments.values().stream()
                .filter(a -> a.getStatus().occupiesQuota())
                .mapToLong(Attachment::getSizeBytes)
                .sum();
    }

    private Attachment transition(String objectKey, AttachmentStatus next, String message) {
        Attachment attachment = require(objectKey);
        if (!attachment.transitionTo(next, message)) {
            throw new AttachmentException(String.format(
                "Transição inválida do anexo de %s para %s", attachment.getStatus().wireName(), next.wireName()));
        }
        return attachment.copy();
    }

    private Attachment require(String objectKey) {
        Attachment attachment = attachments.get(objectKey);
        if (attachment == null) {
            throw new AttachmentException("Anexo não encontrado: " + objectKey);
        }
        return attachment;
    }
}
