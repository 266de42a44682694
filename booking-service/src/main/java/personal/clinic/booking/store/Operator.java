package personal.clinic.booking.store;

/**
 * 조건 연산자
 */
public enum Operator {
    EQ,
    NE,
    IN,
    LT,
    LTE,
    GT,
    GTE
}
