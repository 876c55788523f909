package xyz.firestige.engine.infrastructure.dns;

public enum DnsRecordType {
    A,
    AAAA,
    CNAME
}
