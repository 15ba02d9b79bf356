package io.fset.server.dto;

/** On-disk shape of the optional store configuration file. */
public class JsonStoreConfig {
    public String url;
    public String user;
    public String password;
    public Integer maxConnections;
}
