package com.coopvault.access;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A role held by a principal.
 */
@Entity
@Table(name = "role_grants",
    uniqueConstraints = @UniqueConstraint(name = "uk_role_grant", columnNames = {"principal", "role"}),
    indexes = @Index(name = "idx_role_grant_role", columnList = "role"))
@Data
@NoArgsConstructor
public class RoleGrant {

    @Id
    private String grantId;

    @Column(nullable = false)
    private String principal;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Role role;

    private String grantedBy;

    @Column(name = "granted_at")
    private Instant grantedAt;

    public RoleGrant(String principal, Role role, String grantedBy) {
        this.grantId = UUID.randomUUID().toString();
        this.principal = principal;
        this.role = role;
        this.grantedBy = grantedBy;
        this.grantedAt = Instant.now();
    }
}
