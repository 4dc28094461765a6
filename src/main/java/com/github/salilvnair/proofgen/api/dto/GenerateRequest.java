package com.github.salilvnair.proofgen.api.dto;

import lombok.Data;

@Data
public class GenerateRequest {

    private String workspaceRoot;
    private Boolean preview;
    private Boolean force;
    private Boolean validate;
    private Boolean validateOnly;
}
