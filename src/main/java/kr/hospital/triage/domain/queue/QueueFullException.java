package kr.hospital.triage.domain.queue;

/**
 * 대기열이 최대 수용 인원에 도달해 접수할 수 없을 때 발생하는 예외
 */
public class QueueFullException extends RuntimeException {

    public QueueFullException(String message) {
        super(message);
    }

    // 편의 팩토리 메서드
    public static QueueFullException of(int capacity) {
        return new QueueFullException(
                String.format("대기열이 가득 찼습니다. 최대 수용 인원: %d명", capacity)
        );
    }
}
