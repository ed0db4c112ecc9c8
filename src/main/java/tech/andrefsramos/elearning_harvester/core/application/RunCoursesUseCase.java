package tech.andrefsramos.elearning_harvester.core.application;

import tech.andrefsramos.elearning_harvester.core.domain.RunReport;
import tech.andrefsramos.elearning_harvester.core.domain.SourceInfo;
import tech.andrefsramos.elearning_harvester.core.domain.SourceOutcome;

import java.util.List;

public interface RunCoursesUseCase {
    List<SourceInfo> listSources();
    SourceOutcome runOne(String key);
    RunReport runAll(CancellationSignal signal);
    RunReport runAll(CancellationSignal signal, int concurrency);
}
