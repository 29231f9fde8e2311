package com.mentorship.scheduling.repository;

import com.mentorship.scheduling.entity.UserAccount;
import com.mentorship.scheduling.entity.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface UserAccountRepository extends JpaRepository<UserAccount, Long> {

    List<UserAccount> findByRoleOrderByDisplayName(UserRole role);
}
