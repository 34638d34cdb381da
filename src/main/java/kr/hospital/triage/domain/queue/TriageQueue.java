package kr.hospital.triage.domain.queue;

import kr.hospital.triage.domain.patient.Patient;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 선착순(FCFS) 접수 대기열
 * - 이중 연결 리스트 기반: 뒤에 추가 O(1), 앞에서 제거 O(1)
 * - 최대 수용 인원(capacity)은 선택 사항이며 생성 후 변경 불가
 * - 중증도/접수번호와 무관하게 들어온 순서대로만 진료한다
 * - 동기화하지 않는다. 여러 스레드에서 쓰려면 호출 측에서 직렬화해야 한다
 */
public class TriageQueue {

    private Node head;
    private Node tail;
    private int size;
    private final Integer capacity;  // null 이면 무제한

    private TriageQueue(Integer capacity) {
        if (capacity != null && capacity <= 0) {
            throw new IllegalArgumentException("최대 수용 인원은 1 이상이어야 합니다: " + capacity);
        }
        this.capacity = capacity;
    }

    public static TriageQueue unbounded() {
        return new TriageQueue(null);
    }

    public static TriageQueue withCapacity(int capacity) {
        return new TriageQueue(capacity);
    }

    // capacity 가 null 이면 무제한
    public static TriageQueue of(Integer capacity) {
        return new TriageQueue(capacity);
    }

    public boolean isFull() {
        return capacity != null && size >= capacity;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * 환자를 대기열 맨 뒤에 추가한다.
     * 필드 값(이름, 중증도, 중복 ID)은 검사하지 않는다.
     *
     * @return 가득 찬 경우 false (대기열은 변경되지 않음)
     */
    public boolean arrive(Patient patient) {
        if (isFull()) {
            return false;
        }

        Node node = new Node(patient);
        if (head == null) {
            head = tail = node;
        } else {
            tail.next = node;
            node.prev = tail;
            tail = node;
        }

        size++;
        return true;
    }

    /**
     * 맨 앞 환자를 꺼낸다. 비어 있으면 Optional.empty() 이며 상태는 그대로다.
     */
    public Optional<Patient> serveNext() {
        if (head == null) {
            return Optional.empty();
        }

        Node node = head;
        head = node.next;
        if (head != null) {
            head.prev = null;
        } else {
            tail = null;
        }
        node.next = null;

        size--;
        return Optional.of(node.patient);
    }

    public Optional<Patient> peekFront() {
        return head == null ? Optional.empty() : Optional.of(head.patient);
    }

    public Optional<Patient> peekRear() {
        return tail == null ? Optional.empty() : Optional.of(tail.patient);
    }

    // 앞 -> 뒤 순서의 스냅샷 (이후 변경이 반영되지 않는 복사본)
    public List<Patient> traverseForward() {
        List<Patient> result = new ArrayList<>(size);
        for (Node current = head; current != null; current = current.next) {
            result.add(current.patient);
        }
        return result;
    }

    // 뒤 -> 앞 순서의 스냅샷, prev 링크를 따라간다
    public List<Patient> traverseBackward() {
        List<Patient> result = new ArrayList<>(size);
        for (Node current = tail; current != null; current = current.prev) {
            result.add(current.patient);
        }
        return result;
    }

    public int size() {
        return size;
    }

    public OptionalInt capacity() {
        return capacity == null ? OptionalInt.empty() : OptionalInt.of(capacity);
    }

    public QueueCondition condition() {
        return QueueCondition.of(size, capacity);
    }

    private static final class Node {
        private final Patient patient;
        private Node prev;  // 앞쪽
        private Node next;  // 뒤쪽

        private Node(Patient patient) {
            this.patient = patient;
        }
    }
}
