package com.taxprep.fdg.io;

import com.taxprep.fdg.SampleReturns;
import com.taxprep.fdg.model.FilingStatus;
import com.taxprep.fdg.model.ValidatedInformation;
import com.taxprep.fdg.scenario.Modification;
import com.taxprep.fdg.scenario.Scenario;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class InformationReaderTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testReadsBundledSnapshot() throws IOException {
        ValidatedInformation info = InformationReader.readResource("single-filer.json");
        assertEquals(2025, info.taxYear());
        assertEquals(FilingStatus.S, info.filingStatus());
        assertEquals(1, info.w2s().size());
        assertEquals(50000.0, info.w2s().get(0).income(), 0.0);
        assertTrue(info.businesses().isEmpty());
        assertNull(info.itemizedDeductions());
        assertEquals(0.0, info.studentLoanInterest(), 0.0);
        assertEquals(SampleReturns.singleFiler(50000, 5000), info);
    }

    @Test
    public void testWrittenSnapshotReadsBack() throws IOException {
        ValidatedInformation info = SampleReturns.singleFiler(42000, 3000);
        Path file = tmp.newFile("info.json").toPath();
        Files.writeString(file, Json.write(info));
        assertEquals(info, InformationReader.read(file));
    }

    @Test
    public void testUnknownPropertyRejected() {
        try {
            InformationReader.parse("{\"taxYear\":2025,\"bogus\":1}");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("bogus"));
        }
    }

    @Test(expected = IOException.class)
    public void testMissingResource() throws IOException {
        InformationReader.readResource("nowhere.json");
    }

    @Test
    public void testScenarioFilesRoundTrip() throws IOException {
        Scenario s = Scenario.create("Raise", "desc")
                .plus(Modification.adjust("Raise", "w2s[0].income", 1000));
        Path file = tmp.getRoot().toPath().resolve("scenarios.json");
        ScenarioFiles.write(file, List.of(s));

        List<Scenario> read = ScenarioFiles.read(file);
        assertEquals(1, read.size());
        assertEquals(s.id(), read.get(0).id());
        assertEquals(s.modifications().get(0).id(), read.get(0).modifications().get(0).id());
        assertEquals(1000.0, read.get(0).modifications().get(0).value().asDouble(), 0.0);
    }
}
