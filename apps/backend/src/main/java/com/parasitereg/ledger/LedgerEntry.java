package com.parasitereg.ledger;

import com.parasitereg.registry.model.ParasiteRecord;

/** 按 id 顺序读出的一行账本：当前记录 + 其链节点 */
public record LedgerEntry(ParasiteRecord record, LedgerLink link) {}
