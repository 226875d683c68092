package com.eduhub.learning_backend.modules.admin.service;

import com.eduhub.learning_backend.common.exception.BizException;
import com.eduhub.learning_backend.common.vo.PageVo;
import com.eduhub.learning_backend.modules.admin.vo.DistributionStatusVo;
import com.eduhub.learning_backend.modules.earnings.config.RevenueProperties;
import com.eduhub.learning_backend.modules.earnings.domain.Period;
import com.eduhub.learning_backend.modules.earnings.entity.SubscriptionRevenuePool;
import com.eduhub.learning_backend.modules.earnings.mapper.SubscriptionRevenuePoolMapper;
import com.eduhub.learning_backend.modules.earnings.service.RevenueReconcileService;
import com.eduhub.learning_backend.modules.earnings.service.SubscriptionRevenueService;
import com.eduhub.learning_backend.modules.earnings.vo.DistributionResult;
import com.eduhub.learning_backend.modules.earnings.vo.ReconcileReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.List;

/**
 * 管理端订阅收益任务：手动分配、对账、状态与收益池查询。
 */
@Service
@Slf4j
public class AdminRevenueService {

    private final SubscriptionRevenueService revenueService;
    private final RevenueReconcileService reconcileService;
    private final SubscriptionRevenuePoolMapper poolMapper;
    private final RevenueProperties revenueProperties;
    private final Clock clock;

    public AdminRevenueService(SubscriptionRevenueService revenueService,
                               RevenueReconcileService reconcileService,
                               SubscriptionRevenuePoolMapper poolMapper,
                               RevenueProperties revenueProperties,
                               Clock clock) {
        this.revenueService = revenueService;
        this.reconcileService = reconcileService;
        this.poolMapper = poolMapper;
        this.revenueProperties = revenueProperties;
        this.clock = clock;
    }

    public DistributionResult distribute(String period, String operatorId) {
        Period target = StringUtils.hasText(period) ? Period.parse(period) : Period.previous(clock);
        log.info("Manual revenue distribution requested. period={}, operatorId={}", target, operatorId);
        return revenueService.distributeRevenue(target);
    }

    public ReconcileReport reconcile(String period, String operatorId) {
        Period target = Period.parse(period);
        log.info("Manual revenue reconcile requested. period={}, operatorId={}", target, operatorId);
        return reconcileService.reconcile(target);
    }

    public DistributionStatusVo getStatus() {
        DistributionStatusVo vo = new DistributionStatusVo();
        vo.setSchedulerEnabled(revenueProperties.isDistributionEnabled());
        poolMapper.selectLastDistributed().ifPresent(pool -> {
            vo.setLastDistributedPeriod(pool.getPeriod());
            vo.setDistributedAt(pool.getDistributedAt());
            vo.setStatus(pool.getStatus());
            vo.setTeacherPool(pool.getTeacherPool());
        });
        return vo;
    }

    public PageVo<SubscriptionRevenuePool> listPools(int page, int size) {
        if (page < 1) {
            throw new BizException("page 必须 >= 1");
        }
        if (size < 1 || size > 100) {
            throw new BizException("size 取值范围为 1-100");
        }
        long total = poolMapper.countAll();
        long offset = (long) (page - 1) * size;
        if (total == 0 || offset >= total) {
            return new PageVo<>(total, page, size, List.of());
        }
        List<SubscriptionRevenuePool> list = poolMapper.findPaginated(offset, size);
        return new PageVo<>(total, page, size, list);
    }
}
