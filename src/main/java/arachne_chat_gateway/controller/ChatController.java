package arachne_chat_gateway.controller;

import arachne_chat_gateway.chat.ClientContext;
import arachne_chat_gateway.dto.request.AttachmentRequest;
import arachne_chat_gateway.dto.request.AttachmentRetryRequest;
import arachne_chat_gateway.dto.request.AttachmentStatusRequest;
import arachne_chat_gateway.dto.request.ChatPromptRequest;
import arachne_chat_gateway.dto.response.ErrorResponse;
import arachne_chat_gateway.model.Attachment;
import arachne_chat_gateway.model.Conversation;
import arachne_chat_gateway.service.AttachmentService;
import arachne_chat_gateway.service.AuthSessionService;
import arachne_chat_gateway.service.ChatStreamService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Chat", description = "Streaming de respostas do agente e anexos da próxima mensagem")
public class ChatController {

    private final AuthSessionService authSessionService;
    private final ChatStreamService chatStreamService;
    private final AttachmentService attachmentService;

    @Operation(
            summary = "Enviar mensagem e acompanhar a resposta",
            description = "Abre a conexão com o agente e emite, via Server-Sent Events, o estado da mensagem do assistente após cada evento do protocolo."
    )
    @ApiResponse(responseCode = "200", description = "Stream iniciado", content = @Content(mediaType = MediaType.TEXT_EVENT_STREAM_VALUE))
    @ApiResponse(responseCode = "400", description = "Mensagem vazia ou anexos ainda não enviados",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    @ApiResponse(responseCode = "401", description = "Sessão inválida ou expirada",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    @ApiResponse(responseCode = "409", description = "Já existe uma resposta em andamento",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@Valid @RequestBody ChatPromptRequest request,
                             HttpServletRequest httpRequest,
                             HttpServletResponse httpResponse) {
        ClientContext context = authSessionService.requireFreshContext(httpRequest, httpResponse);
        return chatStreamService.openStream(context, request);
    }

    @Operation(summary = "Cancelar a resposta em andamento",
            description = "Envia o sinal de cancelamento ao agente. A resposta parcial é mantida.")
    @ApiResponse(responseCode = "202", description = "Cancelamento enviado")
    @ApiResponse(responseCode = "409", description = "Nenhuma resposta em andamento",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    @PostMapping("/cancel")
    public ResponseEntity<Void> cancel(HttpServletRequest httpRequest, HttpServletResponse httpResponse) {
        ClientContext context = authSessionService.requireFreshContext(httpRequest, httpResponse);
        if (!chatStreamService.cancel(context)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
        return ResponseEntity.accepted().build();
    }

    @Operation(summary = "Consultar a conversa atual")
    @ApiResponse(responseCode = "200", description = "Conversa retornada com sucesso")
    @GetMapping("/conversation")
    public ResponseEntity<Conversation> conversation(HttpServletRequest httpRequest, HttpServletResponse httpResponse) {
        ClientContext context = authSessionService.requireFreshContext(httpRequest, httpResponse);
        return ResponseEntity.ok(chatStreamService.conversation(context));
    }

    @Operation(summary = "Iniciar nova conversa", description = "Descarta a conversa atual. Recusado enquanto há resposta em andamento.")
    @ApiResponse(responseCode = "204", description = "Conversa reiniciada")
    @ApiResponse(responseCode = "409", description = "Resposta em andamento",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    @DeleteMapping("/conversation")
    public ResponseEntity<Void> resetConversation(HttpServletRequest httpRequest, HttpServletResponse httpResponse) {
        ClientContext context = authSessionService.requireFreshContext(httpRequest, httpResponse);
        chatStreamService.resetConversation(context);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Registrar anexo", description = "Valida tipo e tamanho agregado (20 MB) e registra o anexo como pendente.")
    @ApiResponse(responseCode = "201", description = "Anexo registrado")
    @ApiResponse(responseCode = "400", description = "Tipo não permitido ou limite de tamanho excedido",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    @PostMapping("/attachments")
    public ResponseEntity<Attachment> registerAttachment(@Valid @RequestBody AttachmentRequest request,
                                                         HttpServletRequest httpRequest,
                                                         HttpServletResponse httpResponse) {
        ClientContext context = authSessionService.requireFreshContext(httpRequest, httpResponse);
        return ResponseEntity.status(HttpStatus.CREATED).body(attachmentService.register(context, request));
    }

    @Operation(summary = "Atualizar estado de upload")
    @ApiResponse(responseCode = "200", description = "Estado atualizado")
    @ApiResponse(responseCode = "400", description = "Transição inválida ou anexo inexistente",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    @PutMapping("/attachments/status")
    public ResponseEntity<Attachment> updateAttachmentStatus(@Valid @RequestBody AttachmentStatusRequest request,
                                                             HttpServletRequest httpRequest,
                                                             HttpServletResponse httpResponse) {
        ClientContext context = authSessionService.requireFreshContext(httpRequest, httpResponse);
        return ResponseEntity.ok(attachmentService.updateStatus(context, request));
    }

    @Operation(summary = "Reenviar anexo com erro", description = "Revalida o anexo e o coloca novamente como pendente.")
    @ApiResponse(responseCode = "200", description = "Anexo pendente novamente")
    @PostMapping("/attachments/retry")
    public ResponseEntity<Attachment> retryAttachment(@Valid @RequestBody AttachmentRetryRequest request,
                                                      HttpServletRequest httpRequest,
                                                      HttpServletResponse httpResponse) {
        ClientContext context = authSessionService.requireFreshContext(httpRequest, httpResponse);
        return ResponseEntity.ok(attachmentService.retry(context, request.getObjectKey()));
    }

    @Operation(summary = "Remover anexo")
    @ApiResponse(responseCode = "204", description = "Anexo removido")
    @DeleteMapping("/attachments")
    public ResponseEntity<Void> removeAttachment(
            @Parameter(description = "Chave do objeto", required = true, example = "uploads/2026/10/foto.png")
            @RequestParam String objectKey,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse) {
        ClientContext context = authSessionService.requireFreshContext(httpRequest, httpResponse);
        attachmentService.remove(context, objectKey);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Listar anexos do rascunho")
    @ApiResponse(responseCode = "200", description = "Anexos retornados com sucesso")
    @GetMapping("/attachments")
    public ResponseEntity<List<Attachment>> listAttachments(HttpServletRequest httpRequest,
                                                            HttpServletResponse httpResponse) {
        ClientContext context = authSessionService.requireFreshContext(httpRequest, httpResponse);
        return ResponseEntity.ok(attachmentService.list(context));
    }
}
