package kr.hospital.triage.domain.session;

import kr.hospital.triage.domain.patient.Patient;
import kr.hospital.triage.domain.queue.QueueCondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class TriageSessionTest {

    @Test
    @DisplayName("접수할 때마다 접수 번호가 1부터 증가한다")
    void arrivalNumbersIncrease() {
        // given
        TriageSession session = TriageSession.withCapacity(null);

        // when
        Patient first = session.admit(101L, "John", 3).orElseThrow();
        Patient second = session.admit(102L, "Sarah", 4).orElseThrow();

        // then
        assertThat(first.arrivalTime()).isEqualTo(1L);
        assertThat(second.arrivalTime()).isEqualTo(2L);
        assertThat(session.lastArrivalNumber()).isEqualTo(2L);
        assertThat(session.capacity()).isEmpty();
    }

    @Test
    @DisplayName("거절된 접수도 접수 번호를 소비한다")
    void rejectedAdmissionConsumesNumber() {
        // given
        TriageSession session = TriageSession.withCapacity(1);
        session.admit(101L, "John", 3);

        // when
        Optional<Patient> rejected = session.admit(102L, "Sarah", 4);
        session.serveNext();
        Patient next = session.admit(103L, "Mike", 2).orElseThrow();

        // then
        assertThat(rejected).isEmpty();
        assertThat(next.arrivalTime()).isEqualTo(3L);
    }

    @Test
    @DisplayName("세션은 대기열 상태와 통계를 그대로 노출한다")
    void delegatesToQueue() {
        // given
        TriageSession session = TriageSession.withCapacity(2);
        session.admit(1L, "A", 1);
        session.admit(2L, "B", 5);

        // then
        assertThat(session.isFull()).isTrue();
        assertThat(session.isEmpty()).isFalse();
        assertThat(session.size()).isEqualTo(2);
        assertThat(session.condition()).isEqualTo(QueueCondition.FULL);
        assertThat(session.peekFront().map(Patient::name)).contains("A");
        assertThat(session.peekRear().map(Patient::name)).contains("B");
        assertThat(session.forwardSnapshot()).extracting(Patient::name).containsExactly("A", "B");
        assertThat(session.backwardSnapshot()).extracting(Patient::name).containsExactly("B", "A");
        assertThat(session.statistics().max()).hasValue(5);
    }
}
