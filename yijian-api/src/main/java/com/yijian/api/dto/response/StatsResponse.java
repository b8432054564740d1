package com.yijian.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.yijian.common.constants.Subject;
import com.yijian.data.model.CorpusStats;
import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
public class StatsResponse {
    private long total;
    @JsonProperty("by_subject")
    private Map<String, Long> bySubject;
    @JsonProperty("store_type")
    private String storeType;

    /**
     * Every subject appears, keyed by display name, zero when the corpus has none.
     */
    public static StatsResponse from(CorpusStats stats, String storeType) {
        Map<String, Long> bySubject = new LinkedHashMap<>();
        for (Subject subject : Subject.values()) {
            bySubject.put(subject.getDisplayName(), stats.getBySubject().getOrDefault(subject, 0L));
        }
        return StatsResponse.builder()
            .total(stats.getTotal())
            .bySubject(bySubject)
            .storeType(storeType)
            .build();
    }
}
