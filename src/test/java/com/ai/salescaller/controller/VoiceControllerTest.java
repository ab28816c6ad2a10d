package com.ai.salescaller.controller;

import com.ai.salescaller.config.CallerProperties;
import com.ai.salescaller.dto.AudioRef;
import com.ai.salescaller.dto.VoiceDirective;
import com.ai.salescaller.exception.UnknownSessionException;
import com.ai.salescaller.service.CallFlowService;
import com.ai.salescaller.service.TwimlRenderer;
import com.ai.salescaller.service.speech.AudioCache;
import com.ai.salescaller.service.speech.SynthesizedAudio;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(VoiceController.class)
@Import({TwimlRenderer.class, CallerProperties.class})
class VoiceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CallFlowService callFlowService;

    @MockBean
    private AudioCache audioCache;

    @Test
    void shouldAnswerCallWithGatherAroundSynthesizedPrompt() throws Exception {
        when(callFlowService.callAnswered("CA1", "+15550009999", "+15551230001", "outbound-api", "human"))
                .thenReturn(VoiceDirective.gather(AudioRef.url("https://caller.test/audio/a1")));

        mockMvc.perform(post("/voice")
                        .param("CallSid", "CA1")
                        .param("From", "+15550009999")
                        .param("To", "+15551230001")
                        .param("Direction", "outbound-api")
                        .param("AnsweredBy", "human"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("<Gather input=\"speech\" action=\"https://caller.test/gather/CA1\"")))
                .andExpect(content().string(containsString("<Play>https://caller.test/audio/a1</Play>")))
                .andExpect(content().string(containsString("<Redirect method=\"POST\">https://caller.test/gather/CA1</Redirect>")))
                .andExpect(content().string(not(containsString("<Hangup/>"))));
    }

    @Test
    void shouldSpeakDegradedClosingAndHangUp() throws Exception {
        when(callFlowService.customerSpoke("CA1", "no thanks", "0.91", null))
                .thenReturn(VoiceDirective.sayAndHangup(AudioRef.degradedSpokenText("Thanks & goodbye")));

        mockMvc.perform(post("/gather/CA1")
                        .param("SpeechResult", "no thanks")
                        .param("Confidence", "0.91"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("<Say voice=\"Polly.Joanna-Neural\">Thanks &amp; goodbye</Say><Hangup/>")))
                .andExpect(content().string(not(containsString("<Gather"))));
    }

    @Test
    void shouldHangUpOnWebhookForUnknownCall() throws Exception {
        when(callFlowService.customerSpoke(eq("CA404"), any(), any(), any()))
                .thenThrow(new UnknownSessionException("CA404"));

        mockMvc.perform(post("/gather/CA404").param("SpeechResult", "hello"))
                .andExpect(status().isOk())
                .andExpect(content().string("<?xml version=\"1.0\" encoding=\"UTF-8\"?><Response><Hangup/></Response>"));
    }

    @Test
    void shouldApologizeAndEndCallWhenTurnFailsUnexpectedly() throws Exception {
        when(callFlowService.customerSpoke(eq("CA2"), any(), any(), any()))
                .thenThrow(new IllegalStateException("boom"));
        when(callFlowService.abortCall("CA2")).thenReturn("Sorry, technical trouble.");

        mockMvc.perform(post("/gather/CA2").param("SpeechResult", "yes"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("Sorry, technical trouble.</Say><Hangup/>")));

        verify(callFlowService).abortCall("CA2");
    }

    @Test
    void shouldPassFinalStatusToCallFlow() throws Exception {
        mockMvc.perform(post("/status")
                        .param("CallSid", "CA3")
                        .param("CallStatus", "completed")
                        .param("CallDuration", "42"))
                .andExpect(status().isOk());

        verify(callFlowService).callStatus("CA3", "completed", 42);
    }

    @Test
    void shouldAcceptStatusWithoutDuration() throws Exception {
        mockMvc.perform(post("/status")
                        .param("CallSid", "CA3")
                        .param("CallStatus", "ringing"))
                .andExpect(status().isOk());

        verify(callFlowService).callStatus(eq("CA3"), eq("ringing"), isNull());
    }

    @Test
    void shouldServeCachedAudio() throws Exception {
        byte[] bytes = "ID3-audio".getBytes(StandardCharsets.US_ASCII);
        when(audioCache.get("a1")).thenReturn(Optional.of(new SynthesizedAudio(bytes, "audio/mpeg")));

        mockMvc.perform(get("/audio/a1"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", "audio/mpeg"))
                .andExpect(content().bytes(bytes));
    }

    @Test
    void shouldReturnNotFoundForExpiredAudio() throws Exception {
        when(audioCache.get(anyString())).thenReturn(Optional.empty());

        mockMvc.perform(get("/audio/gone"))
                .andExpect(status().isNotFound());
    }
}
