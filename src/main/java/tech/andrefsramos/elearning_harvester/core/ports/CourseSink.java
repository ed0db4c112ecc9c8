package tech.andrefsramos.elearning_harvester.core.ports;

import tech.andrefsramos.elearning_harvester.core.domain.CourseRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface CourseSink {

    /**
     * Persiste os registros de uma vez. Registros inválidos são sinalizados e ignorados.
     *
     * @return quantidade de linhas gravadas
     */
    int write(List<CourseRecord> records, Path out) throws IOException;
}
