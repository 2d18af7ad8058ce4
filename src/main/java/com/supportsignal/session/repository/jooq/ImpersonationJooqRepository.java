package com.supportsignal.session.repository.jooq;

import static org.jooq.impl.DSL.*;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Table;
import org.springframework.stereotype.Repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * jOOQ queries behind the impersonation admin screens.
 *
 * Both queries join users (and companies) in a single statement instead of
 * loading sessions through JPA and fetching each user separately.
 * Tables are referenced by name; there is no jOOQ code generation step.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ImpersonationJooqRepository {

    private final DSLContext dsl;

    private static final Table<?> IMPERSONATIONS = table(name("impersonation_sessions")).as("imp");
    private static final Table<?> ADMINS = table(name("users")).as("admin_user");
    private static final Table<?> TARGETS = table(name("users")).as("target_user");
    private static final Table<?> USERS = table(name("users")).as("u");
    private static final Table<?> COMPANIES = table(name("companies")).as("c");

    private static final Field<Long> IMP_ID = field(name("imp", "id"), Long.class);
    private static final Field<Long> IMP_ADMIN_ID = field(name("imp", "admin_user_id"), Long.class);
    private static final Field<Long> IMP_TARGET_ID = field(name("imp", "target_user_id"), Long.class);
    private static final Field<String> IMP_REASON = field(name("imp", "reason"), String.class);
    private static final Field<Boolean> IMP_ACTIVE = field(name("imp", "is_active"), Boolean.class);
    private static final Field<OffsetDateTime> IMP_CREATED_AT = field(name("imp", "created_at"), OffsetDateTime.class);
    private static final Field<OffsetDateTime> IMP_EXPIRES_AT = field(name("imp", "expires_at"), OffsetDateTime.class);
    private static final Field<String> IMP_CORRELATION_ID = field(name("imp", "correlation_id"), String.class);

    private static final Field<Long> ADMIN_ID = field(name("admin_user", "id"), Long.class);
    private static final Field<String> ADMIN_NAME = field(name("admin_user", "name"), String.class);
    private static final Field<String> ADMIN_EMAIL = field(name("admin_user", "email"), String.class);

    private static final Field<Long> TARGET_ID = field(name("target_user", "id"), Long.class);
    private static final Field<String> TARGET_NAME = field(name("target_user", "name"), String.class);
    private static final Field<String> TARGET_EMAIL = field(name("target_user", "email"), String.class);
    private static final Field<String> TARGET_ROLE = field(name("target_user", "role"), String.class);

    private static final Field<Long> USERS_ID = field(name("u", "id"), Long.class);
    private static final Field<String> USERS_NAME = field(name("u", "name"), String.class);
    private static final Field<String> USERS_EMAIL = field(name("u", "email"), String.class);
    private static final Field<String> USERS_ROLE = field(name("u", "role"), String.class);
    private static final Field<Long> USERS_COMPANY_ID = field(name("u", "company_id"), Long.class);

    private static final Field<Long> COMPANIES_ID = field(name("c", "id"), Long.class);
    private static final Field<String> COMPANIES_NAME = field(name("c", "name"), String.class);

    /**
     * Lists every live overlay with admin and target details.
     *
     * Overlays whose admin or target user no longer exists drop out through
     * the inner joins.
     *
     * @param now reference time for expiry
     * @return live overlays, newest first
     */
    public List<ActiveImpersonationDTO> findLiveSessionsWithUsers(Instant now) {
        OffsetDateTime reference = now.atOffset(ZoneOffset.UTC);

        return dsl
            .select(
                IMP_ID,
                ADMIN_ID, ADMIN_NAME, ADMIN_EMAIL,
                TARGET_ID, TARGET_NAME, TARGET_EMAIL, TARGET_ROLE,
                IMP_REASON,
                IMP_CREATED_AT,
                IMP_EXPIRES_AT,
                IMP_CORRELATION_ID
            )
            .from(IMPERSONATIONS)
            .join(ADMINS).on(IMP_ADMIN_ID.eq(ADMIN_ID))
            .join(TARGETS).on(IMP_TARGET_ID.eq(TARGET_ID))
            .where(IMP_ACTIVE.isTrue())
            .and(IMP_EXPIRES_AT.gt(reference))
            .orderBy(IMP_CREATED_AT.desc())
            .fetch()
            .map(r -> new ActiveImpersonationDTO(
                r.get(IMP_ID),
                new UserSummaryDTO(r.get(ADMIN_ID), r.get(ADMIN_NAME), r.get(ADMIN_EMAIL), null),
                new UserSummaryDTO(r.get(TARGET_ID), r.get(TARGET_NAME), r.get(TARGET_EMAIL), r.get(TARGET_ROLE)),
                r.get(IMP_REASON),
                r.get(IMP_CREATED_AT).toInstant(),
                r.get(IMP_EXPIRES_AT).toInstant(),
                r.get(IMP_CORRELATION_ID)
            ));
    }

    /**
     * Searches users by name or email for the impersonation picker.
     *
     * The search term is bound as a value and its LIKE wildcards are escaped.
     *
     * @param searchTerm optional case-insensitive fragment of name or email
     * @param excludedRole role to hide from the result, or null to show all
     * @param limit maximum rows
     * @return matching users ordered by name
     */
    public List<UserSearchDTO> searchUsers(String searchTerm, String excludedRole, int limit) {
        Condition condition = noCondition();

        if (excludedRole != null) {
            condition = condition.and(USERS_ROLE.ne(excludedRole));
        }

        if (searchTerm != null && !searchTerm.isBlank()) {
            String term = searchTerm.trim();
            condition = condition.and(
                USERS_NAME.containsIgnoreCase(term).or(USERS_EMAIL.containsIgnoreCase(term))
            );
        }

        log.debug("Searching impersonation candidates: hasTerm={}, excludedRole={}, limit={}",
            searchTerm != null && !searchTerm.isBlank(), excludedRole, limit);

        return dsl
            .select(USERS_ID, USERS_NAME, USERS_EMAIL, USERS_ROLE, COMPANIES_NAME)
            .from(USERS)
            .leftJoin(COMPANIES).on(USERS_COMPANY_ID.eq(COMPANIES_ID))
            .where(condition)
            .orderBy(USERS_NAME.asc(), USERS_ID.asc())
            .limit(limit)
            .fetch()
            .map(r -> new UserSearchDTO(
                r.get(USERS_ID),
                r.get(USERS_NAME),
                r.get(USERS_EMAIL),
                r.get(USERS_ROLE),
                r.get(COMPANIES_NAME)
            ));
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record UserSummaryDTO(
        Long id,
        String name,
        String email,
        String role
    ) {}

    public record ActiveImpersonationDTO(
        Long sessionId,
        UserSummaryDTO adminUser,
        UserSummaryDTO targetUser,
        String reason,
        Instant createdAt,
        Instant expiresAt,
        String correlationId
    ) {}

    public record UserSearchDTO(
        Long id,
        String name,
        String email,
        String role,
        String companyName
    ) {}
}
