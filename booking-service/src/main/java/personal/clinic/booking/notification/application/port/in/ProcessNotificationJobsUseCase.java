package personal.clinic.booking.notification.application.port.in;

/**
 * Process Notification Jobs UseCase (Input Port)
 */
public interface ProcessNotificationJobsUseCase {

    /**
     * @return 처리한 작업 수
     */
    int processPendingJobs();
}
