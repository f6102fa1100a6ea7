package com.novoflow.novoflow_backend.model.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeHandles {

    private List<HandleDefinition> inputs = new ArrayList<>();

    private List<HandleDefinition> outputs = new ArrayList<>();

    public Optional<HandleDefinition> findOutputByDataType(String dataType) {
        if (outputs == null || dataType == null) return Optional.empty();
        return outputs.stream().filter(h -> dataType.equals(h.getDataType())).findFirst();
    }

    public Optional<HandleDefinition> firstFileOutput() {
        if (outputs == null) return Optional.empty();
        return outputs.stream().filter(h -> DataTypes.isFileType(h.getDataType())).findFirst();
    }
}
