package com.sopgenerator.core.parser;

/**
 * XML namespaces read by the BPMN parser.
 */
final class BpmnNamespaces {

    static final String MODEL = "http://www.omg.org/spec/BPMN/20100524/MODEL";
    static final String DI = "http://www.omg.org/spec/BPMN/20100524/DI";
    static final String DC = "http://www.omg.org/spec/DD/20100524/DC";
    static final String ZEEBE = "http://camunda.org/schema/zeebe/1.0";
    static final String CAMUNDA = "http://camunda.org/schema/1.0/bpmn";

    static final String FORMAT_SLA = "application/x-sla";
    static final String FORMAT_SCOPE = "application/x-scope";
    static final String FORMAT_POLICY = "application/x-policy";
    static final String FORMAT_RESPONSIBLE = "application/x-responsible";
    static final String FORMAT_ACCOUNTABLE = "application/x-accountable";
    static final String FORMAT_CONSULTED = "application/x-consulted";
    static final String FORMAT_INFORMED = "application/x-informed";

    private BpmnNamespaces() {
    }
}
