package com.ai.salescaller.service.dispatch;

import com.ai.salescaller.conversation.CallSession;
import com.ai.salescaller.conversation.ExtractedFields;
import com.ai.salescaller.conversation.Speaker;
import com.ai.salescaller.conversation.Turn;
import com.ai.salescaller.service.record.OutcomeUpdate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the dispatch snapshot of a terminal session and the record-store update derived from it.
 */
@Component
public class CallOutcomeReportFactory {

    private final Clock clock;

    public CallOutcomeReportFactory(Clock clock) {
        this.clock = clock;
    }

    public CallOutcomeReport from(CallSession session) {
        Map<String, String> data = session.getExtractedData();
        long duration = session.getDuration().getSeconds();
        Instant endedAt = session.getEndedAt() != null ? session.getEndedAt() : clock.instant();
        return CallOutcomeReport.builder()
                .callId(session.getCallId())
                .customerRef(session.getCustomerRef())
                .customerName(session.getCustomer().getName())
                .carModel(session.getCustomer().getCarModel())
                .extractedData(data)
                .transcript(transcript(session.getTurnHistory()))
                .durationSeconds(duration)
                .outcome(session.getOutcome())
                .nextAction(session.getOutcome().nextAction(data))
                .callNotes(callNotes(session.getOutcome().wireName(), duration, data))
                .endedAt(endedAt)
                .build();
    }

    public OutcomeUpdate toUpdate(CallOutcomeReport report) {
        Map<String, String> data = report.getExtractedData();
        return OutcomeUpdate.builder()
                .outcome(report.getOutcome().wireName())
                .nextAction(report.getNextAction())
                .extractedData(data)
                .email(data.get(ExtractedFields.EMAIL))
                .appointmentTime(data.get(ExtractedFields.APPOINTMENT_TIME))
                .durationSeconds(report.getDurationSeconds())
                .transcript(report.getTranscript())
                .notes(report.getCallNotes())
                .calledAt(report.getEndedAt())
                .build();
    }

    static String transcript(List<Turn> turns) {
        return turns.stream()
                .map(t -> (t.getSpeaker() == Speaker.SYSTEM ? "System: " : "Customer: ") + t.getText())
                .collect(Collectors.joining("\n"));
    }

    static String callNotes(String outcome, long durationSeconds, Map<String, String> data) {
        List<String> notes = new ArrayList<>();
        notes.add("Call duration: " + durationSeconds + " seconds");
        notes.add("Outcome: " + outcome);
        if (ExtractedFields.YES.equals(data.get(ExtractedFields.STILL_INTERESTED))) {
            notes.add("Customer confirmed interest");
        }
        if (ExtractedFields.NO.equals(data.get(ExtractedFields.STILL_INTERESTED))) {
            notes.add("Customer no longer interested in the enquired model");
        }
        if (ExtractedFields.YES.equals(data.get(ExtractedFields.WANTS_APPOINTMENT))) {
            notes.add("Customer wants to schedule appointment");
        }
        if (data.containsKey(ExtractedFields.APPOINTMENT_TIME_SPOKEN)) {
            notes.add("Appointment: " + data.get(ExtractedFields.APPOINTMENT_TIME_SPOKEN));
        }
        if (ExtractedFields.YES.equals(data.get(ExtractedFields.WANTS_SIMILAR))) {
            notes.add("Customer wants similar car options");
        }
        if (data.containsKey(ExtractedFields.EMAIL)) {
            notes.add("Email collected: " + data.get(ExtractedFields.EMAIL));
        }
        return String.join(". ", notes);
    }
}
