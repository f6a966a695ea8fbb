package com.workflow.payroll_backend.controller;

import com.jayway.jsonpath.JsonPath;
import com.workflow.payroll_backend.repository.EmployeeRepository;
import com.workflow.payroll_backend.repository.PayrollItemRepository;
import com.workflow.payroll_backend.repository.PayrollRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PayrollControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private EmployeeRepository employeeRepository;
    @Autowired private PayrollRepository payrollRepository;
    @Autowired private PayrollItemRepository payrollItemRepository;

    @BeforeEach
    void setUp() throws Exception {
        payrollItemRepository.deleteAllInBatch();
        payrollRepository.deleteAllInBatch();
        employeeRepository.deleteAllInBatch();

        createEmployee("""
                {"name": "A", "salary": 1000}
                """);
        createEmployee("""
                {"name": "B", "salary": 2000, "status": "on_leave"}
                """);
        createEmployee("""
                {"name": "C", "salary": 3000, "status": "exited"}
                """);
    }

    private void createEmployee(String body) throws Exception {
        mockMvc.perform(post("/employees")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated());
    }

    private long approve(int month, int year) throws Exception {
        MvcResult result = mockMvc.perform(post("/payroll/approve")
                        .param("month", String.valueOf(month))
                        .param("year", String.valueOf(year)))
                .andExpect(status().isOk())
                .andReturn();
        return ((Number) JsonPath.read(result.getResponse().getContentAsString(), "$.payroll_id")).longValue();
    }

    @Test
    void previewPayroll_returnsActiveEmployeesOnly() throws Exception {
        mockMvc.perform(get("/payroll/preview").param("month", "5").param("year", "2024"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.month").value(5))
                .andExpect(jsonPath("$.year").value(2024))
                .andExpect(jsonPath("$.total_cost").value(900.0))
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andExpect(jsonPath("$.items[0].name").value("A"))
                .andExpect(jsonPath("$.items[0].employee_id").isNumber())
                .andExpect(jsonPath("$.items[0].gross").value(1000.0))
                .andExpect(jsonPath("$.items[0].deductions").value(100.0))
                .andExpect(jsonPath("$.items[0].net").value(900.0));
    }

    @Test
    void previewPayroll_missingYear_returns422() throws Exception {
        mockMvc.perform(get("/payroll/preview").param("month", "5"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"));
    }

    @Test
    void previewPayroll_monthOutOfRange_returns422() throws Exception {
        mockMvc.perform(get("/payroll/preview").param("month", "13").param("year", "2024"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void previewPayroll_nonNumericMonth_returns422() throws Exception {
        mockMvc.perform(get("/payroll/preview").param("month", "May").param("year", "2024"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void approvePayroll_returnsIdAndMessage_andRunIsReadable() throws Exception {
        MvcResult result = mockMvc.perform(post("/payroll/approve").param("month", "6").param("year", "2024"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payroll_id").isNumber())
                .andExpect(jsonPath("$.message").value("Payroll approved"))
                .andReturn();
        long payrollId = ((Number) JsonPath.read(result.getResponse().getContentAsString(), "$.payroll_id")).longValue();

        mockMvc.perform(get("/payrolls/{id}", payrollId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(payrollId))
                .andExpect(jsonPath("$.month").value(6))
                .andExpect(jsonPath("$.year").value(2024))
                .andExpect(jsonPath("$.total_cost").value(900.0))
                .andExpect(jsonPath("$.approved_at").isNotEmpty())
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andExpect(jsonPath("$.items[0].name").value("A"));
    }

    @Test
    void approvePayroll_invalidMonth_returns422_andStoresNothing() throws Exception {
        mockMvc.perform(post("/payroll/approve").param("month", "0").param("year", "2024"))
                .andExpect(status().isUnprocessableEntity());

        mockMvc.perform(get("/payrolls"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void listPayrolls_returnsSummariesMostRecentFirst() throws Exception {
        long older = approve(12, 2023);
        long newer = approve(2, 2024);

        mockMvc.perform(get("/payrolls"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].id").value(newer))
                .andExpect(jsonPath("$[0].month").value(2))
                .andExpect(jsonPath("$[0].total_cost").value(900.0))
                .andExpect(jsonPath("$[0].approved_at").isNotEmpty())
                .andExpect(jsonPath("$[0].items").doesNotExist())
                .andExpect(jsonPath("$[1].id").value(older));
    }

    @Test
    void getPayroll_unknownId_returns404() throws Exception {
        mockMvc.perform(get("/payrolls/{id}", 999999))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("RESOURCE_NOT_FOUND"));
    }
}
