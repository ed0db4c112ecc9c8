package tech.andrefsramos.elearning_harvester.adapters.outbound.sink;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.elearning_harvester.core.domain.CourseRecord;
import tech.andrefsramos.elearning_harvester.core.ports.CourseSink;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/*
 * Finalidade

 * Grava os registros agregados num CSV (UTF-8, RFC-4180) com colunas em ordem fixa.

 * Como funciona
 * - Cria os diretórios pais do arquivo de saída.
 * - Escreve num arquivo temporário no mesmo diretório e move para o destino ao final:
 *   uma falha no meio da gravação não deixa arquivo parcial.
 * - Campos nulos viram células vazias.
 * - Registros inválidos (provider ou url vazios) são sinalizados em WARN e ignorados.
 */
public class CsvCourseSink implements CourseSink {
    private static final Logger log = LoggerFactory.getLogger(CsvCourseSink.class);

    public static final List<String> COLUMNS = List.of(
            "course_id", "course_title", "url", "is_paid", "price", "num_subscribers", "num_reviews",
            "num_lectures", "level", "content_duration", "published_timestamp", "subject", "provider", "language");

    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();
    private final CsvSchema schema;

    public CsvCourseSink() {
        CsvSchema.Builder b = CsvSchema.builder();
        COLUMNS.forEach(b::addColumn);
        this.schema = b.build().withoutHeader();
    }

    @Override
    public int write(List<CourseRecord> records, Path out) throws IOException {
        final long t0 = System.nanoTime();
        final Path target = out.toAbsolutePath();
        final Path dir = target.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }

        final Path tmp = Files.createTempFile(dir, target.getFileName().toString() + ".", ".tmp");
        int written = 0;
        int rejected = 0;
        try {
            try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                try (SequenceWriter seq = mapper.writerFor(String[].class).with(schema).writeValues(w)) {
                    // cabeçalho passa pelo mesmo gerador: mesma regra de quoting das linhas, inclusive sem registros
                    seq.write(COLUMNS.toArray(new String[0]));
                    for (CourseRecord r : records == null ? List.<CourseRecord>of() : records) {
                        if (r == null || !r.isValid()) {
                            rejected++;
                            log.warn("CsvCourseSink: registro inválido ignorado (provider/url vazios) id={} provider={}",
                                    r == null ? null : r.id(), r == null ? null : r.provider());
                            continue;
                        }
                        seq.write(toRow(r));
                        written++;
                    }
                }
            }
            moveIntoPlace(tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }

        long tookMs = (System.nanoTime() - t0) / 1_000_000;
        log.info("CsvCourseSink: gravado arquivo={} linhas={} rejeitados={} tookMs={}ms", target, written, rejected, tookMs);
        return written;
    }

    static String[] toRow(CourseRecord r) {
        return new String[]{
                r.id(),
                r.title(),
                r.url(),
                str(r.isPaid()),
                r.price(),
                str(r.numSubscribers()),
                str(r.numReviews()),
                str(r.numLectures()),
                r.level(),
                r.contentDuration(),
                r.publishedTimestamp(),
                r.subject(),
                r.provider(),
                r.language()
        };
    }

    private static String str(Object o) {
        return o == null ? null : o.toString();
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("CsvCourseSink: move atômico não suportado, usando move simples. target={}", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
