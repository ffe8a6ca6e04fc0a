package com.faultline.triage.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows and metadata returned by an NRQL query.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NrqlResult {

    @Builder.Default
    private List<Map<String, Object>> results = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public static NrqlResult empty() {
        return NrqlResult.builder().build();
    }
}
