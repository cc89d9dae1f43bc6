package com.coopvault.api.dto;

import lombok.Data;

/**
 * DTO carrying an operator's reason or note.
 */
@Data
public class ReasonRequest {

    private String reason;
}
