package com.purchasingpower.codegraph.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SourceListResponse {
    private int total;
    private List<CodeSourceResponse> sources;
}
