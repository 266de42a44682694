package personal.clinic.booking.catalog.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data JPA Repository for ClinicService
 */
public interface JpaClinicServiceRepository extends JpaRepository<ClinicServiceEntity, String> {
}
