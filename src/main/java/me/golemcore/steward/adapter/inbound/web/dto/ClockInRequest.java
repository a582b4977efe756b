package me.golemcore.steward.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClockInRequest {
    private String role;
    private String focus;
    private String workingDir;
    private String model;
    private String transcriptPath;
}
