package com.pshcalculator.model;

import java.time.LocalDate;

/**
 * Worksheet sign-off block. Carried through to the result unchanged apart
 * from trimming; blank names become null.
 */
public record AuditInfo(
    String haStaff,
    LocalDate calculationDate,
    String supervisorName,     // set once a supervisor approves an FMR exception
    LocalDate supervisorDate
) {}
