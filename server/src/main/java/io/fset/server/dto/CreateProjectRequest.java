// file: server/src/main/java/io/fset/server/dto/CreateProjectRequest.java
package io.fset.server.dto;

/**
 * JSON body for POST /projects. Every field is optional.
 * Example:
 *   {
 *     "key": "billing",
 *     "description": "Billing service schemas"
 *   }
 */
public class CreateProjectRequest {
    public String anchor;
    public String key;
    public Integer order;
    public String description;
}
