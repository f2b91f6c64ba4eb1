package com.iot.common.dto.diagnosis;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Batch completeness counters.
 * A record is complete when none of its model predictions lacked input data.
 */
public record DataQuality(
    @JsonProperty("total_records")
    int totalRecords,

    @JsonProperty("complete_records")
    int completeRecords,

    @JsonProperty("incomplete_records")
    int incompleteRecords
) {
    public static DataQuality of(int totalRecords, int completeRecords) {
        return new DataQuality(totalRecords, completeRecords, totalRecords - completeRecords);
    }
}
