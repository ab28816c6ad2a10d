package com.ai.salescaller.controller;

import com.ai.salescaller.dto.VoiceDirective;
import com.ai.salescaller.exception.UnknownSessionException;
import com.ai.salescaller.service.CallFlowService;
import com.ai.salescaller.service.TwimlRenderer;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;

/**
 * Twilio must always get TwiML with a 200, otherwise the caller hears Twilio's own error message.
 */
@ControllerAdvice(assignableTypes = VoiceController.class)
class WebhookExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(WebhookExceptionHandler.class);

    private final CallFlowService callFlowService;
    private final TwimlRenderer twimlRenderer;

    WebhookExceptionHandler(CallFlowService callFlowService, TwimlRenderer twimlRenderer) {
        this.callFlowService = callFlowService;
        this.twimlRenderer = twimlRenderer;
    }

    @ExceptionHandler(UnknownSessionException.class)
    ResponseEntity<String> handleUnknownSession(UnknownSessionException ex) {
        log.warn("[{}] Webhook for unknown or finished call; hanging up", ex.getCallId());
        return twiml(twimlRenderer.render(VoiceDirective.hangupOnly(), ex.getCallId()));
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<String> handleUnexpected(Exception ex, HttpServletRequest request) {
        String callSid = callSidOf(request);
        log.error("[{}] Webhook {} failed; ending call with apology", callSid, request.getRequestURI(), ex);
        return twiml(twimlRenderer.apologyAndHangup(callFlowService.abortCall(callSid)));
    }

    private static ResponseEntity<String> twiml(String body) {
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_XML).body(body);
    }

    @SuppressWarnings("unchecked")
    private static String callSidOf(HttpServletRequest request) {
        String callSid = request.getParameter("CallSid");
        if (callSid != null) {
            return callSid;
        }
        Object vars = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (vars instanceof Map) {
            return ((Map<String, String>) vars).get("callId");
        }
        return null;
    }
}
