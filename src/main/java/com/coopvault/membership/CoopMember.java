package com.coopvault.membership;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Membership registry row.
 */
@Entity
@Table(name = "coop_members", indexes = {
    @Index(name = "idx_member_status", columnList = "status")
})
@Data
@NoArgsConstructor
public class CoopMember {

    @Id
    private String principal;

    @Enumerated(EnumType.STRING)
    private MemberStatus status;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public CoopMember(String principal) {
        this.principal = principal;
        this.status = MemberStatus.ACTIVE;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    public void suspend() {
        this.status = MemberStatus.SUSPENDED;
        this.updatedAt = Instant.now();
    }

    public void reactivate() {
        this.status = MemberStatus.ACTIVE;
        this.updatedAt = Instant.now();
    }

    public boolean isActive() {
        return status == MemberStatus.ACTIVE;
    }
}
