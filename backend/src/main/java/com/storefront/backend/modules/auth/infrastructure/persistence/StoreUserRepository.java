package com.storefront.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.storefront.backend.modules.auth.domain.StoreUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StoreUserRepository extends JpaRepository<StoreUser, UUID> {

    @Query("select su from StoreUser su where lower(su.email) = lower(:email) and su.active = true")
    Optional<StoreUser> findActiveByEmailIgnoreCase(@Param("email") String email);

    @Query("select case when count(su) > 0 then true else false end from StoreUser su where lower(su.username) = lower(:username)")
    boolean existsByUsernameIgnoreCase(@Param("username") String username);

    @Query("select case when count(su) > 0 then true else false end from StoreUser su where lower(su.email) = lower(:email)")
    boolean existsByEmailIgnoreCase(@Param("email") String email);
}
