package io.hfmcp.gateway.server.tools;

import java.util.List;

/**
 * Ids of the local tools. Ids double as the registered tool names.
 */
public final class ToolIds {

    public static final String WHOAMI = "hf_whoami";
    public static final String SPACE_SEARCH = "space_search";
    public static final String MODEL_SEARCH = "model_search";
    public static final String DATASET_SEARCH = "dataset_search";
    public static final String PAPER_SEARCH = "paper_search";
    public static final String REPO_DETAILS = "hub_repo_details";
    public static final String DOC_SEARCH = "hf_doc_search";
    public static final String DOC_FETCH = "hf_doc_fetch";
    public static final String JOBS = "hf_jobs";

    /** Every selectable tool id. {@link #WHOAMI} is always registered and is not selectable. */
    public static final List<String> ALL = List.of(
        SPACE_SEARCH, MODEL_SEARCH, DATASET_SEARCH, PAPER_SEARCH, REPO_DETAILS, DOC_SEARCH, DOC_FETCH, JOBS);

    private ToolIds() {
    }
}
