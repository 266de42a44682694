package personal.clinic.booking.catalog.adapter.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.clinic.booking.catalog.domain.model.BusinessHours;

import java.time.LocalTime;

@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BusinessHoursEmbeddable {

    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    @Column(name = "is_open", nullable = false)
    private boolean open;

    @Column(name = "start_time")
    private LocalTime startTime;

    @Column(name = "end_time")
    private LocalTime endTime;

    public static BusinessHoursEmbeddable fromDomain(BusinessHours hours) {
        BusinessHoursEmbeddable embeddable = new BusinessHoursEmbeddable();
        embeddable.dayOfWeek = hours.dayOfWeek();
        embeddable.open = hours.open();
        embeddable.startTime = hours.startTime();
        embeddable.endTime = hours.endTime();
        return embeddable;
    }

    public BusinessHours toDomain() {
        return new BusinessHours(dayOfWeek, open, startTime, endTime);
    }
}
