package com.hypothesis.api;

import com.hypothesis.agent.TurnResponse;
import com.hypothesis.core.StepPayload;
import com.hypothesis.core.StepResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response from the chat endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private boolean success;
    private String sessionId;
    private String mode;
    private String response;
    private String objective;
    private boolean degraded;
    private String error;

    @Builder.Default
    private List<String> followUps = new ArrayList<>();

    @Builder.Default
    private List<Step> steps = new ArrayList<>();

    public static ChatResponse from(TurnResponse turn) {
        return ChatResponse.builder()
            .success(true)
            .sessionId(turn.getSessionId())
            .mode(turn.getMode().getLabel())
            .response(turn.getText())
            .objective(turn.getPlan() != null ? turn.getPlan().objective() : null)
            .degraded(turn.isDegraded())
            .followUps(new ArrayList<>(turn.getFollowUps()))
            .steps(turn.getPlan() == null ? new ArrayList<>() : turn.getResults().stream()
                .map(result -> Step.from(result, turn.getPlan().steps().get(result.index()).query()))
                .collect(Collectors.toList()))
            .build();
    }

    public static ChatResponse error(String error) {
        return ChatResponse.builder()
            .success(false)
            .error(error)
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Step {
        private int index;
        private String tool;
        private String query;
        private String status;
        private String errorKind;
        private String message;
        private int attempts;
        private String executedQuery;
        private StepPayload data;

        static Step from(StepResult result, String query) {
            return Step.builder()
                .index(result.index())
                .tool(result.tool())
                .query(query)
                .status(result.status().name())
                .errorKind(result.errorKind() != null ? result.errorKind().name() : null)
                .message(result.message())
                .attempts(result.attempts())
                .executedQuery(result.executedQuery())
                .data(result.payload())
                .build();
        }
    }
}
