@NamedInterface("api")
package kr.jemi.zcassa.inventory.api;

import org.springframework.modulith.NamedInterface;
