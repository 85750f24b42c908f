package com.aqiforecast.cli;

import com.aqiforecast.domain.RetrainingExitStatus;
import com.aqiforecast.domain.RetrainingOutcome;
import com.aqiforecast.domain.Severity;
import com.aqiforecast.exception.ConcurrencyConflictException;
import com.aqiforecast.exception.UnknownModelException;
import com.aqiforecast.service.RetrainingOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * One-shot retraining from the command line: {@code --retrain=<model> [--reason=<text>]}.
 * Blocks until the run finishes and reports the result as the process exit code.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetrainCommand implements ApplicationRunner, ExitCodeGenerator {

    public static final String OPTION = "retrain";

    private final RetrainingOrchestrator orchestrator;

    private volatile RetrainingExitStatus exitStatus = RetrainingExitStatus.SUCCESS;

    @Override
    public void run(ApplicationArguments args) {
        List<String> models = args.getOptionValues(OPTION);
        if (models == null || models.isEmpty()) {
            return;
        }
        List<String> reasons = args.getOptionValues("reason");
        String reason = reasons == null || reasons.isEmpty() ? "command line request" : reasons.get(0);
        exitStatus = execute(models.get(0), reason);
    }

    public RetrainingExitStatus execute(String predictorId, String reason) {
        try {
            RetrainingOutcome outcome = orchestrator.retrainNow(predictorId, reason, Severity.HIGH).get();
            log.info("Command line retraining finished | predictor={} | state={} | version={} | reason={}",
                predictorId, outcome.finalState(), outcome.version(), outcome.failureReason());
            return outcome.exitStatus();
        } catch (UnknownModelException ex) {
            log.error("Command line retraining rejected | predictor={} | reason={}", predictorId, ex.getMessage());
            return RetrainingExitStatus.UNKNOWN_MODEL;
        } catch (ConcurrencyConflictException ex) {
            log.error("Command line retraining rejected | predictor={} | reason={}", predictorId, ex.getMessage());
            return RetrainingExitStatus.CONFLICT;
        } catch (ExecutionException ex) {
            log.error("Command line retraining failed | predictor={}", predictorId, ex.getCause());
            return RetrainingExitStatus.VALIDATION_FAILED;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.error("Command line retraining interrupted | predictor={}", predictorId);
            return RetrainingExitStatus.VALIDATION_FAILED;
        }
    }

    public RetrainingExitStatus getExitStatus() {
        return exitStatus;
    }

    @Override
    public int getExitCode() {
        return exitStatus.code();
    }
}
