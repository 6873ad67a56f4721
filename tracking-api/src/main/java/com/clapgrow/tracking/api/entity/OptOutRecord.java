package com.clapgrow.tracking.api.entity;

import com.clapgrow.tracking.common.event.EngagementEventType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Explicit recipient opt-out. Kept permanently; the retention pass never reads this table.
 */
@Entity
@Table(name = "opt_out_records", uniqueConstraints = {
    @UniqueConstraint(name = "uk_opt_out_recipient", columnNames = "recipient_hash")
})
@Getter
@Setter
@NoArgsConstructor
public class OptOutRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "recipient_hash", nullable = false, length = 64)
    private String recipientHash;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "opt_out_suppressed_types", joinColumns = @JoinColumn(name = "opt_out_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", length = 20, nullable = false)
    private Set<EngagementEventType> suppressedEventTypes = new HashSet<>();

    @Column(name = "opted_out_at", nullable = false)
    private LocalDateTime optedOutAt;

    @Column(name = "source", length = 50)
    private String source;

    public boolean suppresses(EngagementEventType eventType) {
        return suppressedEventTypes.contains(eventType);
    }

    public Set<EngagementEventType> suppressedCopy() {
        return suppressedEventTypes.isEmpty()
            ? EnumSet.noneOf(EngagementEventType.class)
            : EnumSet.copyOf(suppressedEventTypes);
    }
}
