package dev.newsroom.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewerWorkload {
    private String staffId;
    private String name;
    private String role;
    private long assignedCount;
    /** Days the longest-waiting assigned item has been in its stage; null when none. */
    private Long oldestAssignedDays;
}
