package com.company.monitoring.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActiveStage {
    private String projectId;
    private String projectName;
    private String companyId;
    private String companyName;
    private String stageId;
    private String stageName;
}
