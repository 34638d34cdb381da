package kr.hospital.triage.domain.queue;

/**
 * 대기 중인 환자가 없을 때 발생하는 예외
 */
public class QueueEmptyException extends RuntimeException {

    public QueueEmptyException(String message) {
        super(message);
    }

    public static QueueEmptyException nothingToServe() {
        return new QueueEmptyException("대기 중인 환자가 없어 진료를 호출할 수 없습니다");
    }

    public static QueueEmptyException nothingToView() {
        return new QueueEmptyException("대기 중인 환자가 없습니다");
    }
}
