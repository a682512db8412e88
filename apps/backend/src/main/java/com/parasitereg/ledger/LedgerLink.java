package com.parasitereg.ledger;

/**
 * 一条记录在账本哈希链上的节点：hash = SHA256((prevHash or "") + canonical)。
 */
public record LedgerLink(long recordId, String prevHash, String hash, String canonical) {}
