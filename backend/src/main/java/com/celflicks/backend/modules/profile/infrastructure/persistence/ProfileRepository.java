package com.celflicks.backend.modules.profile.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.celflicks.backend.modules.profile.domain.Profile;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

public interface ProfileRepository extends JpaRepository<Profile, UUID> {

    /**
     * {@code FOR UPDATE SKIP LOCKED}: rows held by another in-flight signup are skipped instead of waited on.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("select p from Profile p where lower(p.username) = lower(:username)")
    List<Profile> findByUsernameIgnoreCaseSkipLocked(@Param("username") String username);

    @Query("""
            select case when count(p) > 0 then true else false end
              from Profile p
             where lower(p.username) = lower(:username)
               and p.id <> :excludedId
            """)
    boolean existsByUsernameIgnoreCaseAndIdNot(@Param("username") String username, @Param("excludedId") UUID excludedId);

    @Query("select p from Profile p where lower(p.username) = lower(:username)")
    Optional<Profile> findByUsernameIgnoreCase(@Param("username") String username);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Profile p where p.id = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}
