package com.workflow.payroll_backend.service;

import com.workflow.payroll_backend.dto.response.PayrollItemResponse;
import com.workflow.payroll_backend.dto.response.PayrollPreviewResponse;
import com.workflow.payroll_backend.dto.response.PayrollResponse;
import com.workflow.payroll_backend.dto.response.PayrollSummaryResponse;
import com.workflow.payroll_backend.enums.EmployeeStatus;
import com.workflow.payroll_backend.model.Employee;
import com.workflow.payroll_backend.model.Payroll;
import com.workflow.payroll_backend.model.PayrollItem;
import com.workflow.payroll_backend.repository.EmployeeRepository;
import com.workflow.payroll_backend.repository.PayrollRepository;
import com.workflow.payroll_backend.util.PayrollCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class PayrollService {

    private final EmployeeRepository employeeRepository;
    private final PayrollRepository payrollRepository;
    private final PayrollCalculator payrollCalculator;
    private final ModelMapper modelMapper;

    /**
     * Computes the payroll of every active employee for the period. Nothing is stored.
     * Employees on leave or exited are left out.
     */
    @Transactional(readOnly = true)
    public PayrollPreviewResponse previewPayroll(int month, int year) {
        List<PayrollItemResponse> items = employeeRepository.findByStatusOrderByIdAsc(EmployeeStatus.ACTIVE)
                .stream()
                .map(payrollCalculator::calculate)
                .collect(Collectors.toList());

        BigDecimal totalCost = items.stream()
                .map(PayrollItemResponse::getNet)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        log.debug("Payroll preview for {}/{}: {} items, total {}", month, year, items.size(), totalCost);

        return PayrollPreviewResponse.builder()
                .month(month)
                .year(year)
                .totalCost(totalCost)
                .items(items)
                .build();
    }

    /**
     * Computes the preview and stores it as a new run in the same transaction. Approving a period
     * that already has a run creates another, independent run.
     *
     * @return id of the new run
     */
    @Transactional
    public Long approvePayroll(int month, int year) {
        PayrollPreviewResponse preview = previewPayroll(month, year);

        Payroll payroll = Payroll.builder()
                .month(preview.getMonth())
                .year(preview.getYear())
                .totalCost(preview.getTotalCost())
                .build();

        for (PayrollItemResponse line : preview.getItems()) {
            Employee employee = employeeRepository.getReferenceById(line.getEmployeeId());
            PayrollItem item = PayrollItem.builder()
                    .employeeName(line.getName())
                    .gross(line.getGross())
                    .deductions(line.getDeductions())
                    .net(line.getNet())
                    .build();
            item.setEmployee(employee);
            payroll.addItem(item);
        }

        Payroll savedPayroll = payrollRepository.save(payroll);
        log.info("Payroll approved with ID: {} for {}/{} ({} items, total {})",
                savedPayroll.getId(), month, year, savedPayroll.getItems().size(), savedPayroll.getTotalCost());

        return savedPayroll.getId();
    }

    @Transactional(readOnly = true)
    public List<PayrollSummaryResponse> getAllPayrolls() {
        return payrollRepository.findAllByOrderByYearDescMonthDescIdAsc()
                .stream()
                .map(payroll -> modelMapper.map(payroll, PayrollSummaryResponse.class))
                .collect(Collectors.toList());
    }

    /**
     * Reads a stored run back. Item names come from the snapshot taken at approval, so renaming
     * an employee later does not rewrite history.
     */
    @Transactional(readOnly = true)
    public Optional<PayrollResponse> getPayrollById(Long id) {
        return payrollRepository.findWithItemsById(id).map(this::mapToPayrollResponse);
    }

    private PayrollResponse mapToPayrollResponse(Payroll payroll) {
        List<PayrollItemResponse> items = payroll.getItems()
                .stream()
                .map(this::mapToPayrollItemResponse)
                .collect(Collectors.toList());

        return PayrollResponse.builder()
                .id(payroll.getId())
                .month(payroll.getMonth())
                .year(payroll.getYear())
                .totalCost(payroll.getTotalCost())
                .approvedAt(payroll.getApprovedAt())
                .items(items)
                .build();
    }

    private PayrollItemResponse mapToPayrollItemResponse(PayrollItem item) {
        return PayrollItemResponse.builder()
                .employeeId(item.getEmployeeId())
                .name(item.getEmployeeName())
                .gross(item.getGross())
                .deductions(item.getDeductions())
                .net(item.getNet())
                .build();
    }
}
