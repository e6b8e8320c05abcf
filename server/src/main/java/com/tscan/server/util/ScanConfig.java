package com.tscan.server.util;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tscan.server.detect.DetectionParameters;
import com.tscan.server.detect.ProcessingConfig;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ScanConfig {

    @JsonMerge
    public DetectionParameters detection = new DetectionParameters();

    @JsonMerge
    public ProcessingConfig processing = new ProcessingConfig();

    @JsonProperty("data_directory")
    public String dataDirectory = "";

    @JsonProperty("use_gpu")
    public boolean useGpu = false;
}
