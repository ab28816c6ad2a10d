package com.ai.salescaller.service;

import com.ai.salescaller.config.CallerProperties;
import com.ai.salescaller.dto.AudioRef;
import com.ai.salescaller.dto.VoiceDirective;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Renders a {@link VoiceDirective} as TwiML.
 *
 * <p>Listening is a speech {@code <Gather>}; if Twilio hears nothing the call falls through to a short
 * {@code <Record>} so our own recognizers get a second listen, and finally to a redirect that
 * reports an empty answer.
 */
@Component
public class TwimlRenderer {

    private final CallerProperties properties;
    private final String baseUrl;

    public TwimlRenderer(CallerProperties properties, @Value("${twilio.base-url:}") String baseUrl) {
        this.properties = properties;
        this.baseUrl = StringUtils.removeEnd(StringUtils.trimToEmpty(baseUrl), "/");
    }

    public String render(VoiceDirective directive, String callId) {
        StringBuilder twiml = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?><Response>");
        String prompt = play(directive.getPromptAudioRef());
        if (directive.isExpectMoreInput()) {
            String action = escapeXml(baseUrl + "/gather/" + callId);
            twiml.append("<Gather input=\"speech\" action=\"").append(action)
                    .append("\" method=\"POST\" language=\"en-US\" speechTimeout=\"auto\" timeout=\"")
                    .append(properties.getGatherTimeoutSeconds()).append("\">")
                    .append(prompt)
                    .append("</Gather>");
            twiml.append("<Record action=\"").append(action)
                    .append("\" method=\"POST\" maxLength=\"15\" timeout=\"3\" playBeep=\"false\" trim=\"trim-silence\"/>");
            twiml.append("<Redirect method=\"POST\">").append(action).append("</Redirect>");
        } else {
            twiml.append(prompt);
        }
        if (directive.isHangup()) {
            twiml.append("<Hangup/>");
        }
        return twiml.append("</Response>").toString();
    }

    /** Apology used when the request could not be handled at all. */
    public String apologyAndHangup(String text) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?><Response>" + say(text) + "<Hangup/></Response>";
    }

    private String play(AudioRef ref) {
        if (ref == null) {
            return "";
        }
        if (ref.getKind() == AudioRef.Kind.URL) {
            return "<Play>" + escapeXml(ref.getValue()) + "</Play>";
        }
        return say(ref.getValue());
    }

    private String say(String text) {
        return "<Say voice=\"" + escapeXml(properties.getVoice()) + "\">" + escapeXml(text) + "</Say>";
    }

    static String escapeXml(String raw) {
        if (raw == null) return "";
        return raw
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&apos;");
    }
}
