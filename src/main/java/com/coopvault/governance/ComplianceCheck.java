package com.coopvault.governance;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Compliance check outcome stored with a proposal.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ComplianceCheck {

    @Column(name = "check_name")
    private String name;

    private boolean passed;

    private String note;
}
