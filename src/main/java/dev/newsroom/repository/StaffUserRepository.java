package dev.newsroom.repository;

import dev.newsroom.entity.StaffUser;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

@Repository
public interface StaffUserRepository extends ReactiveCrudRepository<StaffUser, Long> {

    Mono<StaffUser> findByEmail(String email);

    @Query("SELECT * FROM staff_users WHERE active = TRUE AND staff_role IN (:roles) ORDER BY id")
    Flux<StaffUser> findActiveByRoles(Collection<String> roles);

    @Query("SELECT * FROM staff_users WHERE active = TRUE AND translation_language = :language ORDER BY id")
    Flux<StaffUser> findActiveTranslators(String language);
}
