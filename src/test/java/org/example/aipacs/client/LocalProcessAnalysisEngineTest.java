package org.example.aipacs.client;

import org.example.aipacs.exception.EngineRejectedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalProcessAnalysisEngineTest {

    @TempDir
    Path tmp;

    @Test
    void readsFindingsCsvWithMeasurementColumns() throws Exception {
        Path csv = tmp.resolve("findings.csv");
        Files.writeString(csv, String.join("\n",
                "category,confidence,x,y,z,width,height,depth,severity,description,m_volume_ml,m_diameter_mm",
                "nodule,0.93,12,40,3,8,8,2,high,Solid nodule,1.2,9.5",
                "opacity,0.61,100,80,,20,15,,,,,",
                ""));

        List<RawFinding> out = LocalProcessAnalysisEngine.readFindings(csv);

        assertThat(out).hasSize(2);
        RawFinding first = out.get(0);
        assertThat(first.getCategory()).isEqualTo("nodule");
        assertThat(first.getDepth()).isEqualTo(2);
        assertThat(first.getMeasurements()).containsEntry("volume_ml", 1.2).containsEntry("diameter_mm", 9.5);

        RawFinding second = out.get(1);
        assertThat(second.getZ()).isNull();
        assertThat(second.getSeverity()).isNull();
        assertThat(second.getMeasurements()).isEmpty();
    }

    @Test
    void nonNumericConfidenceIsRejected() throws Exception {
        Path csv = tmp.resolve("findings.csv");
        Files.writeString(csv, "category,confidence\nnodule,high\n");
        assertThatThrownBy(() -> LocalProcessAnalysisEngine.readFindings(csv))
                .isInstanceOf(EngineRejectedException.class);
    }
}
