package com.formstudio.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class FormMeta {
    private FormHeaderInfo header;
    private ScanRange scanRange;
    private List<FormIssue> issues = new ArrayList<>();
    private FormEnumerations enums;

    public FormMeta() {
    }

    public FormMeta(FormHeaderInfo header, ScanRange scanRange, FormEnumerations enums) {
        this.header = header;
        this.scanRange = scanRange;
        this.enums = enums;
    }

    public FormHeaderInfo getHeader() {
        return header;
    }

    public void setHeader(FormHeaderInfo header) {
        this.header = header;
    }

    public ScanRange getScanRange() {
        return scanRange;
    }

    public void setScanRange(ScanRange scanRange) {
        this.scanRange = scanRange;
    }

    public List<FormIssue> getIssues() {
        return issues;
    }

    public void setIssues(List<FormIssue> issues) {
        this.issues = issues != null ? new ArrayList<>(issues) : new ArrayList<>();
    }

    public void addIssue(FormIssue issue) {
        issues.add(issue);
    }

    public FormEnumerations getEnums() {
        return enums;
    }

    public void setEnums(FormEnumerations enums) {
        this.enums = enums;
    }
}
