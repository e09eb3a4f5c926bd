package info.isaksson.erland.dtsxmigrate.core;

public enum PackageStatus {
    OK,
    FAILED
}
