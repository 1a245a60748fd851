package com.yunhwan.error.advice.infra.analyzer;

import com.yunhwan.error.advice.domain.advice.Advice;
import com.yunhwan.error.advice.usecase.analysis.port.AdviceAnalyzer;

/**
 * 네트워크 없이 에러 이름/메시지 규칙으로 advice를 만드는 기본 analyzer.
 */
public class StubAdviceAnalyzer implements AdviceAnalyzer {

    static final String MODEL = "stub-rules";

    @Override
    public Advice analyze(AnalysisInput in) {
        String name = safe(in.errorName());
        String msg = safe(in.message()).toLowerCase();

        String summary = "애플리케이션 에러가 감지되었습니다.";
        String action = "스택 트레이스의 첫 애플리케이션 frame과 입력값을 확인하세요.";

        if (name.contains("NullPointer") || msg.contains("cannot read propert") || msg.contains("undefined")) {
            summary = "null/undefined 값을 역참조했습니다.";
            action = "값이 비어 있을 수 있는 경로에 null 체크 또는 기본값을 추가하세요.";
        } else if (name.contains("Timeout") || msg.contains("timed out") || msg.contains("timeout")) {
            summary = "외부 호출이 제한 시간 안에 끝나지 않았습니다.";
            action = "대상 서비스 상태와 타임아웃/재시도 설정을 확인하세요.";
        } else if (msg.contains("connection refused") || msg.contains("econnrefused") || name.contains("Connect")) {
            summary = "대상 서버에 연결할 수 없습니다.";
            action = "호스트/포트 설정과 대상 프로세스 기동 여부를 확인하세요.";
        } else if (name.contains("IllegalArgument") || name.contains("Validation") || name.contains("TypeError")) {
            summary = "잘못된 입력 또는 타입으로 호출되었습니다.";
            action = "호출부에서 전달하는 인자 형식과 검증 규칙을 확인하세요.";
        } else if (name.contains("OutOfMemory") || msg.contains("heap")) {
            summary = "메모리가 부족합니다.";
            action = "메모리 사용량이 큰 캐시/컬렉션과 힙 설정을 점검하세요.";
        } else if (msg.contains("permission") || msg.contains("denied") || name.contains("Security")) {
            summary = "권한 부족으로 작업이 거부되었습니다.";
            action = "실행 계정 권한과 접근 정책을 확인하세요.";
        }

        if (in.code() != null) {
            summary = summary + " (code=" + in.code() + ")";
        }
        return new Advice(summary, action, MODEL);
    }

    private String safe(String s) {
        return s == null ? "" : s;
    }
}
