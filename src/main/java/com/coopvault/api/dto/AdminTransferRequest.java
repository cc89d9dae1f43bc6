package com.coopvault.api.dto;

import lombok.Data;

@Data
public class AdminTransferRequest {

    private String newAdmin;
}
