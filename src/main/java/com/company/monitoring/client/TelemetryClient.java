package com.company.monitoring.client;

import com.company.monitoring.domain.ActiveStage;
import com.company.monitoring.domain.FetchResult;
import com.company.monitoring.domain.StageHeader;

import java.util.List;

/**
 * Read access to the external time-series API.
 */
public interface TelemetryClient {

    /**
     * Latest value of a header. Never throws: failures are returned as error results.
     */
    FetchResult fetchValue(String headerId);

    /**
     * @throws com.company.monitoring.exception.TelemetryApiException when the API cannot be read
     */
    List<ActiveStage> fetchActiveStages();

    /**
     * @throws com.company.monitoring.exception.TelemetryApiException when the API cannot be read
     */
    List<StageHeader> fetchStageHeaders(String stageId);

    boolean ping();
}
