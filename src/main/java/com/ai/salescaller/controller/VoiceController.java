package com.ai.salescaller.controller;

import com.ai.salescaller.dto.VoiceDirective;
import com.ai.salescaller.service.CallFlowService;
import com.ai.salescaller.service.TwimlRenderer;
import com.ai.salescaller.service.speech.AudioCache;
import com.ai.salescaller.service.speech.SynthesizedAudio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Twilio voice webhooks. Every response is TwiML with HTTP 200; failures are turned into a spoken
 * apology by {@link WebhookExceptionHandler}.
 */
@RestController
public class VoiceController {

    private static final Logger log = LoggerFactory.getLogger(VoiceController.class);

    static final String MDC_CALL_SID = "callSid";

    private final CallFlowService callFlowService;
    private final TwimlRenderer twimlRenderer;
    private final AudioCache audioCache;

    public VoiceController(CallFlowService callFlowService, TwimlRenderer twimlRenderer, AudioCache audioCache) {
        this.callFlowService = callFlowService;
        this.twimlRenderer = twimlRenderer;
        this.audioCache = audioCache;
    }

    @PostMapping(value = "/voice", produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> voice(@RequestParam("CallSid") String callSid,
                                        @RequestParam(value = "From", required = false) String from,
                                        @RequestParam(value = "To", required = false) String to,
                                        @RequestParam(value = "Direction", required = false) String direction,
                                        @RequestParam(value = "AnsweredBy", required = false) String answeredBy) {
        return withCallSid(callSid, () -> {
            log.info("Call answered: direction={} answeredBy={}", direction, answeredBy);
            VoiceDirective directive = callFlowService.callAnswered(callSid, from, to, direction, answeredBy);
            return ResponseEntity.ok(twimlRenderer.render(directive, callSid));
        });
    }

    @PostMapping(value = "/gather/{callId}", produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> gather(@PathVariable("callId") String callId,
                                         @RequestParam(value = "SpeechResult", required = false) String speechResult,
                                         @RequestParam(value = "Confidence", required = false) String confidence,
                                         @RequestParam(value = "RecordingUrl", required = false) String recordingUrl) {
        return withCallSid(callId, () -> {
            VoiceDirective directive = callFlowService.customerSpoke(callId, speechResult, confidence, recordingUrl);
            return ResponseEntity.ok(twimlRenderer.render(directive, callId));
        });
    }

    @PostMapping("/status")
    public ResponseEntity<Void> status(@RequestParam("CallSid") String callSid,
                                       @RequestParam(value = "CallStatus", required = false) String callStatus,
                                       @RequestParam(value = "CallDuration", required = false) Integer callDuration) {
        return withCallSid(callSid, () -> {
            log.info("Call status {} (duration {}s)", callStatus, callDuration);
            callFlowService.callStatus(callSid, callStatus, callDuration);
            return ResponseEntity.ok().build();
        });
    }

    @GetMapping("/audio/{id}")
    public ResponseEntity<byte[]> audio(@PathVariable("id") String id) {
        Optional<SynthesizedAudio> audio = audioCache.get(id);
        if (audio.isEmpty()) {
            log.warn("Audio {} not found or expired", id);
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(audio.get().getContentType()))
                .body(audio.get().getBytes());
    }

    private static <T> T withCallSid(String callSid, Supplier<T> handler) {
        MDC.put(MDC_CALL_SID, callSid);
        try {
            return handler.get();
        } finally {
            MDC.remove(MDC_CALL_SID);
        }
    }
}
