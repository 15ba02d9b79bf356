// file: server/src/main/java/io/fset/server/dto/DiffResponse.java
package io.fset.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON response for POST /projects/{name}/diff.
 * On commit:
 *   {
 *     "ok": true,
 *     "projectUpdated": false,
 *     "filesChanged": 0, "fmodelsChanged": 1,
 *     "fmodelsRemoved": 0, "filesRemoved": 0,
 *     "filesAdded": 1, "fmodelsAdded": 2
 *   }
 * On rejection:
 *   {
 *     "ok": false,
 *     "reason": "UNRESOLVED_PARENT",
 *     "error": "fmodel a-m1 references unknown parent file a-missing",
 *     "offendingAnchor": "a-m1"
 *   }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiffResponse {
    public boolean ok;
    public String reason;
    public String error;
    public String offendingAnchor;

    public Boolean projectUpdated;
    public Integer filesChanged;
    public Integer fmodelsChanged;
    public Integer fmodelsRemoved;
    public Integer filesRemoved;
    public Integer filesAdded;
    public Integer fmodelsAdded;
}
