package com.coopvault.api.dto;

import lombok.Data;

@Data
public class ClearingAccountRequest {

    private String clearingAccount;
}
