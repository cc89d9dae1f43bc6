package com.coopvault.membership;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for cooperative members.
 */
@Repository
public interface CoopMemberRepository extends JpaRepository<CoopMember, String> {

    List<CoopMember> findByStatus(MemberStatus status);
}
