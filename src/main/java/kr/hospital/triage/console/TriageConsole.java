package kr.hospital.triage.console;

import kr.hospital.triage.application.port.in.TriageUseCase;
import kr.hospital.triage.application.port.in.TriageUseCase.PatientInfo;
import kr.hospital.triage.application.port.in.TriageUseCase.QueueStatus;
import kr.hospital.triage.application.port.in.TriageUseCase.StatisticsInfo;
import kr.hospital.triage.application.port.in.TriageUseCase.TraversalOrder;
import kr.hospital.triage.domain.patient.TriagePolicy;
import kr.hospital.triage.domain.queue.QueueEmptyException;
import kr.hospital.triage.domain.queue.QueueFullException;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.util.List;

/**
 * 접수 창구 대화형 메뉴
 * - 한 번의 메뉴 선택마다 유스케이스 하나를 호출하고 결과를 출력한다
 * - 9(종료) 선택 또는 입력 스트림 종료 시 루프를 끝낸다
 */
@Slf4j
public class TriageConsole {

    static final int EXIT_OPTION = 9;

    private static final String LINE = "=".repeat(60);
    private static final String THIN_LINE = "-".repeat(60);
    private static final String TABLE_LINE = "  " + "-".repeat(80);

    private final TriageUseCase triageUseCase;
    private final ConsolePrompt prompt;
    private final PrintStream out;

    public TriageConsole(TriageUseCase triageUseCase, ConsolePrompt prompt, PrintStream out) {
        this.triageUseCase = triageUseCase;
        this.prompt = prompt;
        this.out = out;
    }

    public void run() {
        printBanner();

        try {
            int option = 0;
            while (option != EXIT_OPTION) {
                printMenu();
                option = prompt.readInt("메뉴를 선택하세요 (1-9): ", 1, EXIT_OPTION);
                handle(option);
            }
        } catch (ConsoleInputClosedException e) {
            out.println();
            log.debug("입력 종료로 콘솔 세션을 마칩니다");
        }
    }

    void handle(int option) {
        switch (option) {
            case 1 -> admitPatient();
            case 2 -> serveNext();
            case 3 -> showFront();
            case 4 -> showRear();
            case 5 -> showFullStatus();
            case 6 -> showEmptyStatus();
            case 7 -> showQueue();
            case 8 -> showStatistics();
            case 9 -> printGoodbye();
            default -> prompt.error("알 수 없는 메뉴입니다: " + option);
        }
    }

    private void admitPatient() {
        section("신규 환자 접수");
        String name = prompt.readNonEmpty("환자 이름: ");
        int patientId = prompt.readInt("환자 ID: ");
        int severity = prompt.readInt("중증도 (1=경증 ~ 5=위급): ",
                TriagePolicy.MIN_SEVERITY, TriagePolicy.MAX_SEVERITY);

        try {
            PatientInfo admitted = triageUseCase.admit(new TriageUseCase.AdmitCommand(patientId, name, severity));
            prompt.success(String.format("환자 '%s' (ID: %d) 접수 완료 - 접수 #%d",
                    admitted.name(), admitted.id(), admitted.arrivalNumber()));
        } catch (QueueFullException e) {
            prompt.error("접수 실패 - 대기열이 가득 찼습니다!");
        }
    }

    private void serveNext() {
        section("다음 환자 진료 호출");
        try {
            PatientInfo served = triageUseCase.serveNext();
            prompt.success("진료 호출: " + served.name());
            printPatientDetail(served);
        } catch (QueueEmptyException e) {
            prompt.error("진료 호출 불가 - 대기열이 비어있습니다!");
        }
    }

    private void showFront() {
        section("맨 앞 환자 (다음 진료 대상)");
        if (triageUseCase.status().empty()) {
            prompt.error("대기열이 비어있습니다!");
            return;
        }
        printPatientDetail(triageUseCase.front());
    }

    private void showRear() {
        section("맨 뒤 환자 (마지막 접수)");
        if (triageUseCase.status().empty()) {
            prompt.error("대기열이 비어있습니다!");
            return;
        }
        printPatientDetail(triageUseCase.rear());
    }

    private void showFullStatus() {
        section("대기열 수용 현황");
        QueueStatus status = triageUseCase.status();
        String capacity = capacityText(status.capacity());

        if (status.full()) {
            prompt.error(String.format("대기열이 가득 찼습니다! %d/%s명", status.size(), capacity));
        } else {
            prompt.success(String.format("대기열에 여유가 있습니다. %d/%s명", status.size(), capacity));
        }

        out.printf("  상태:           %s%n", status.condition().getDisplayName());
        out.printf("  현재 인원:      %d%n", status.size());
        out.printf("  최대 수용 인원: %s%n", capacity);
        if (status.usagePercent() != null) {
            out.printf("  사용률:         %.1f%%%n", status.usagePercent());
        }
    }

    private void showEmptyStatus() {
        section("대기열 비어있음 확인");
        QueueStatus status = triageUseCase.status();

        if (status.empty()) {
            prompt.error("대기열이 비어있습니다! 대기 중인 환자가 없습니다.");
        } else {
            prompt.success(String.format("대기 중인 환자 %d명", status.size()));
        }
        out.printf("  전체 환자 수: %d%n", status.size());
    }

    private void showQueue() {
        section("전체 대기열 (앞 -> 뒤)");
        List<PatientInfo> patients = triageUseCase.listPatients(TraversalOrder.FORWARD);
        if (patients.isEmpty()) {
            prompt.error("대기열이 비어있습니다! 표시할 환자가 없습니다.");
            return;
        }

        out.println(TABLE_LINE);
        out.printf("  %-4s | %-20s | %-5s | %-10s | %-15s%n", "#", "이름", "ID", "중증도", "접수 순번");
        out.println(TABLE_LINE);
        int index = 1;
        for (PatientInfo p : patients) {
            out.printf("  %-4d | %-20s | %-5d | %-10s | 접수 #%-11d%n",
                    index++, p.name(), p.id(), severityBar(p.severity()), p.arrivalNumber());
        }
        out.println(TABLE_LINE);
        out.printf("%n  대기열 전체 환자 수: %d%n", patients.size());
    }

    private void showStatistics() {
        section("대기열 통계");
        StatisticsInfo stats = triageUseCase.statistics();

        out.println("  [수용 정보]");
        out.printf("    전체 환자 수:   %d%n", stats.totalPatients());
        out.printf("    최대 수용 인원: %s%n", capacityText(stats.capacity()));

        if (stats.totalPatients() == 0) {
            prompt.error("통계를 계산할 환자가 없습니다.");
            return;
        }

        out.println("  [중증도 통계]");
        out.printf("    평균 중증도: %.1f/5%n", stats.averageSeverity());
        out.printf("    최대 중증도: %d/5%n", stats.maxSeverity());
        out.printf("    최소 중증도: %d/5%n", stats.minSeverity());
    }

    private void printGoodbye() {
        section("접수 창구 종료");
        out.println("  이용해 주셔서 감사합니다.");
    }

    private void printPatientDetail(PatientInfo p) {
        out.printf("  이름:      %s%n", p.name());
        out.printf("  환자 ID:   %d%n", p.id());
        out.printf("  중증도:    %d/5%n", p.severity());
        out.printf("  접수 순번: #%d%n", p.arrivalNumber());
    }

    private void printBanner() {
        out.println(LINE);
        out.println("  선착순(FCFS) 접수 창구");
        out.println(LINE);
    }

    private void printMenu() {
        out.println();
        out.println(LINE);
        out.println(" 1. 환자 접수");
        out.println(" 2. 다음 환자 진료 호출 (FIFO)");
        out.println(" 3. 맨 앞 환자 보기");
        out.println(" 4. 맨 뒤 환자 보기");
        out.println(" 5. 대기열 가득 참 여부 확인");
        out.println(" 6. 대기열 비어있음 여부 확인");
        out.println(" 7. 전체 대기열 보기");
        out.println(" 8. 대기열 통계");
        out.println(" 9. 종료");
        out.println(LINE);
    }

    private void section(String title) {
        out.println();
        out.println(THIN_LINE);
        out.println("  " + title);
        out.println(THIN_LINE);
    }

    // 범위를 벗어난 값이 들어와도 막대 길이는 0~5 로 자른다
    static String severityBar(int severity) {
        int filled = Math.max(0, Math.min(severity, TriagePolicy.MAX_SEVERITY));
        return "[" + "*".repeat(filled) + " ".repeat(TriagePolicy.MAX_SEVERITY - filled) + "]";
    }

    private static String capacityText(Integer capacity) {
        return capacity != null ? String.valueOf(capacity) : "무제한";
    }
}
