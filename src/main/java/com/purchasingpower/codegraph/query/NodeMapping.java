package com.purchasingpower.codegraph.query;

import com.purchasingpower.codegraph.core.NodeKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How one end of a triple is read from a result row. Column references are
 * result column names, or zero-based indexes when the result has no names.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeMapping {

    private NodeKind kind;
    private String nameColumn;
    private String fileColumn;
    private String startLineColumn;
    private String endLineColumn;
}
