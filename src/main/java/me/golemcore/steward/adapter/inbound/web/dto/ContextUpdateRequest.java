package me.golemcore.steward.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextUpdateRequest {
    private String target;
    private String intent;
    private String content;
    private String workingDir;
    private String sessionId;
    private boolean delegated;
    private boolean acknowledgeConflicts;

    @Builder.Default
    private Map<String, String> signals = new LinkedHashMap<>();
}
