package dev.newsroom.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Table("staff_users")
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StaffUser implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    private String email;

    @Column("first_name")
    private String firstName;

    @Column("last_name")
    private String lastName;

    @Column("staff_role")
    @Builder.Default
    private String staffRole = StaffRole.JOURNALIST.name();

    /** Language this staff member translates into; null for non-translators. */
    @Column("translation_language")
    private String translationLanguage;

    @Builder.Default
    private Boolean active = true;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    public StaffRole role() {
        return StaffRole.from(staffRole);
    }

    public boolean hasRoleAtLeast(StaffRole minimum) {
        StaffRole role = role();
        return role != null && role.isAtLeast(minimum);
    }

    public boolean isActiveStaff() {
        return Boolean.TRUE.equals(active);
    }

    public String displayName() {
        if (firstName == null && lastName == null) {
            return email;
        }
        return ((firstName != null ? firstName : "") + " " + (lastName != null ? lastName : "")).trim();
    }
}
