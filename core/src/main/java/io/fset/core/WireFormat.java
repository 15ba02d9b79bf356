// file: core/src/main/java/io/fset/core/WireFormat.java
package io.fset.core;

import io.fset.core.model.Fmodel;
import io.fset.core.model.Project;
import io.fset.core.model.ProjectFile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialization direction of the diff protocol: turns a persisted project into
 * the nested document a client diffs against.
 * <p>
 * Shape:
 * <pre>
 *   { "key", "order", "anchor",
 *     "files": [ { "key", "order", "anchor",
 *                  "fmodels": [ { "type", "key", "sch", "is_entry", "anchor" } ] } ] }
 * </pre>
 * Storage identities are never exposed.
 */
public final class WireFormat {

    private WireFormat() {
        // utility
    }

    public static Map<String, Object> toWire(Project project) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("key", project.key());
        out.put("order", project.order());
        out.put("anchor", project.anchor());

        List<Map<String, Object>> files = new ArrayList<>(project.files().size());
        for (ProjectFile f : project.files()) {
            files.add(toWire(f));
        }
        out.put("files", files);
        return out;
    }

    static Map<String, Object> toWire(ProjectFile file) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("key", file.key());
        out.put("order", file.order());
        out.put("anchor", file.anchor());

        List<Map<String, Object>> fmodels = new ArrayList<>(file.fmodels().size());
        for (Fmodel m : file.fmodels()) {
            fmodels.add(toWire(m));
        }
        out.put("fmodels", fmodels);
        return out;
    }

    static Map<String, Object> toWire(Fmodel fmodel) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", fmodel.type());
        out.put("key", fmodel.key());
        out.put("sch", fmodel.sch());
        out.put("is_entry", fmodel.isEntry());
        out.put("anchor", fmodel.anchor());
        return out;
    }
}
