package com.novoflow.novoflow_backend.model.definition;

/** Handle data types understood by the data-flow resolver. */
public final class DataTypes {

    public static final String PDB_FILE = "pdb_file";
    public static final String SEQUENCE = "sequence";
    public static final String MESSAGE  = "message";
    public static final String ANY      = "any";

    private DataTypes() {}

    public static boolean isFileType(String dataType) {
        return dataType != null && dataType.endsWith("_file");
    }

    public static boolean isWildcard(String dataType) {
        return dataType == null || dataType.isBlank() || ANY.equals(dataType);
    }
}
