package com.smartbin.infrastructure.file;

import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import com.smartbin.domain.model.Reading;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Exporta lecturas a CSV con OpenCSV.
 */
@Component
@Slf4j
public class CsvReadingExporter {

    static final String[] CSV_HEADER = {"timestamp", "sensor_id", "peso_kg", "temperatura", "umidade"};
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    /**
     * Escribe el header y una fila por lectura, en el orden recibido.
     *
     * @param readings Lecturas a exportar
     * @return Contenido CSV
     */
    public String export(List<Reading> readings) {
        StringWriter buffer = new StringWriter();

        try (CSVWriter writer = new CSVWriter(buffer,
                ICSVWriter.DEFAULT_SEPARATOR,
                ICSVWriter.NO_QUOTE_CHARACTER,
                ICSVWriter.DEFAULT_ESCAPE_CHARACTER,
                "\n")) {
            writer.writeNext(CSV_HEADER, false);
            for (Reading reading : readings) {
                writer.writeNext(formatRecord(reading), false);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error generando CSV de lecturas", e);
        }

        log.debug("CSV generado con {} lecturas", readings.size());
        return buffer.toString();
    }

    /**
     * Formatea una lectura como fila CSV.
     */
    private String[] formatRecord(Reading reading) {
        return new String[]{
                reading.getTimestamp() != null ? reading.getTimestamp().format(TIMESTAMP_FORMAT) : "",
                reading.getSensorId() != null ? reading.getSensorId() : "",
                String.valueOf(reading.getWeightKg()),
                String.valueOf(reading.getTemperature()),
                String.valueOf(reading.getHumidity())
        };
    }
}
