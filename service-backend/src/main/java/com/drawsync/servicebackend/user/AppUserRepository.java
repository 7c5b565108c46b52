package com.drawsync.servicebackend.user;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Users are provisioned by the account service; the coordinator only looks them up by id.
 */
public interface AppUserRepository extends JpaRepository<AppUser, Long> {
}
