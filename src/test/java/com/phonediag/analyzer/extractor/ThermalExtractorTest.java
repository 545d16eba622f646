package com.phonediag.analyzer.extractor;

import com.phonediag.analyzer.model.DiagValue;
import com.phonediag.analyzer.model.SensorReading;
import com.phonediag.analyzer.model.ThermalRecord;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ThermalExtractorTest {

    private static final String DUMP = String.join("\n",
            "IsStatusOverride: false",
            "Thermal Status: 1",
            "Current temperatures from HAL:",
            "\tTemperature{mValue=350, mType=0, mName=CPU, mStatus=0}",
            "\tTemperature{mValue=35, mType=2, mName=BATTERY, mStatus=0}",
            "\tTemperature{mValue=30.0, mType=3, mName=SKIN, mStatus=0}",
            "\tTemperature{mValue=1.2.3, mType=1, mName=GPU, mStatus=0}",
            "Cached temperatures:",
            "\tTemperature{mValue=31.5, mType=3, mName=SKIN, mStatus=0}");

    private final ThermalExtractor extractor = new ThermalExtractor();

    private ThermalRecord parse(String dump) {
        return (ThermalRecord) extractor.extract("thermal.txt", dump).getRecord();
    }

    @Test
    void extract_readingAboveThresholdIsTenths() {
        SensorReading cpu = parse(DUMP).sensor("CPU").orElseThrow();
        assertEquals(35.0, cpu.getValue(), 1e-9);
        assertEquals(0, cpu.getType());
    }

    @Test
    void extract_readingAtOrBelowThresholdIsLiteral() {
        SensorReading battery = parse(DUMP).sensor("BATTERY").orElseThrow();
        assertEquals(35.0, battery.getValue(), 1e-9);
        assertEquals(2, battery.getType());

        assertEquals(100.0, parse("Temperature{mValue=100, mType=0, mName=X, mStatus=0}")
                .sensor("X").orElseThrow().getValue(), 1e-9);
    }

    @Test
    void extract_lastReadingForSensorWins() {
        assertEquals(31.5, parse(DUMP).sensor("SKIN").orElseThrow().getValue(), 1e-9);
    }

    @Test
    void extract_malformedReadingIsSkipped() {
        ThermalRecord r = parse(DUMP);
        assertTrue(r.sensor("GPU").isEmpty());
        assertEquals(3, r.getSensors().size());
    }

    @Test
    void extract_readsThermalStatus() {
        assertEquals(DiagValue.ofLong(1), parse(DUMP).getFields().get("thermal_status"));
        assertTrue(parse("no status").getFields().get("thermal_status").isAbsent());
    }
}
