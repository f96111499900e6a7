package me.bechberger.phidetect.scan;

import java.util.ArrayList;
import java.util.List;

/**
 * Sequential scan, one pattern after the other.
 */
public class ReferenceScanBackend implements ScanBackend {

    @Override
    public String name() {
        return "reference";
    }

    @Override
    public List<ScanMatch> scan(String text, List<PatternDef> patterns) {
        List<ScanMatch> matches = new ArrayList<>();
        for (PatternDef pattern : patterns) {
            matches.addAll(pattern.findAll(text));
        }
        return matches;
    }
}
