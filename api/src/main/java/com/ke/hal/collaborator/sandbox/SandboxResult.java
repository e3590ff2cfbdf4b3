package com.ke.hal.collaborator.sandbox;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SandboxResult {
    @JsonProperty("exit_code")
    private int exitCode;
    private String stdout;
    private String stderr;
    @JsonProperty("timed_out")
    private boolean timedOut;
    private List<String> files = new ArrayList<>();

    public static SandboxResult timeout(String stderr) {
        return new SandboxResult(-1, "", stderr, true, new ArrayList<>());
    }

    @JsonIgnore
    public boolean isSuccess() {
        return exitCode == 0 && !timedOut;
    }
}
