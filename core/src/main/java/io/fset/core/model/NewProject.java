// file: core/src/main/java/io/fset/core/model/NewProject.java
package io.fset.core.model;

/**
 * Attributes for provisioning a project.
 * Any field may be null; callers fill anchor and key defaults before storing.
 */
public record NewProject(String anchor, String key, Integer order, String description) {

    public static NewProject empty() {
        return new NewProject(null, null, null, null);
    }

    public NewProject withAnchor(String anchor) {
        return new NewProject(anchor, key, order, description);
    }

    public NewProject withKey(String key) {
        return new NewProject(anchor, key, order, description);
    }
}
