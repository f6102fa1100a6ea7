package com.novoflow.novoflow_backend.model.definition;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class HandleDefinition {

    private String id;

    // pdb_file, sequence, message, any ... null means untyped
    private String dataType;

    /** A concrete data type makes the handle required unless the strategy marks inputs optional. */
    @JsonIgnore
    public boolean hasConcreteType() {
        return dataType != null && !dataType.isBlank();
    }
}
