package com.github.salilvnair.proofgen.api.dto;

import lombok.Data;

@Data
public class VerifyRequest {

    private String receiptPath;
}
