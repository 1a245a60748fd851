package com.yunhwan.error.advice.app.api.analysis;

import com.yunhwan.error.advice.app.analysis.ErrorReportFacade;
import com.yunhwan.error.advice.app.api.analysis.dto.ErrorReportRequest;
import com.yunhwan.error.advice.app.api.analysis.dto.ErrorReportResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/errors")
public class ErrorReportController {

    private final ErrorReportFacade errorReportFacade;

    /**
     * 분석은 비동기. 응답은 fingerprint만 돌려주고, advice는 /api/analysis/advice/{fingerprint}로 조회한다.
     */
    @PostMapping
    public ResponseEntity<ErrorReportResponse> report(@Valid @RequestBody ErrorReportRequest req) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(errorReportFacade.report(req));
    }
}
