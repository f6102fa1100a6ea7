package com.novoflow.novoflow_backend.executor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the file descriptor a file_check node hands downstream.
 * Browser-local blob: URLs never leave the engine; they are swapped for the upload endpoint of
 * the public base URL, or dropped when there is no file id to point at.
 */
public final class FileDescriptors {

    public static final List<String> CONFIG_FIELDS = List.of(
            "filename", "file_id", "file_url", "chains", "total_residues",
            "suggested_contigs", "chain_residue_counts", "atoms");

    private FileDescriptors() {}

    public static Map<String, Object> fromConfig(Map<String, Object> config, String descriptorType, String publicBaseUrl) {
        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("type", descriptorType);
        if (config == null) return descriptor;

        for (String field : CONFIG_FIELDS) {
            Object value = config.get(field);
            if ("file_url".equals(field)) {
                value = sanitizeFileUrl(Values.asString(value), Values.asString(config.get("file_id")), publicBaseUrl);
            }
            if (Values.isPresent(value)) {
                descriptor.put(field, Values.deepCopy(value));
            }
        }
        return descriptor;
    }

    public static String sanitizeFileUrl(String fileUrl, String fileId, String publicBaseUrl) {
        if (fileUrl == null || fileUrl.isEmpty()) return null;
        String base = trimTrailingSlash(publicBaseUrl);

        if (fileUrl.startsWith("blob:")) {
            return fileId != null && !fileId.isEmpty() ? base + "/api/upload/pdb/" + fileId : null;
        }
        if (fileUrl.startsWith("/")) {
            return base + fileUrl;
        }
        return fileUrl;
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) return "";
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
